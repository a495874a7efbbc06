package com.taodividends.backend.repository;

import com.taodividends.backend.model.StakeTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface StakeTransactionRepository extends JpaRepository<StakeTransaction, Long>,
        JpaSpecificationExecutor<StakeTransaction> {
    Optional<StakeTransaction> findByTaskId(String taskId);
}
