package com.taodividends.backend.repository;

import com.taodividends.backend.model.SentimentAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface SentimentAnalysisRepository extends JpaRepository<SentimentAnalysis, Long>,
        JpaSpecificationExecutor<SentimentAnalysis> {
    List<SentimentAnalysis> findByTaskId(String taskId);
}
