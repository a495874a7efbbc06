package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentimentAnalysisResponse {
    private Long id;
    private String taskId;
    private int netuid;
    private String hotkey;
    private double score;
    private int rawScore;
    private int postsCount;
    private String operationType;
    private BigDecimal stakeAmount;
    private Instant analyzedAt;
}
