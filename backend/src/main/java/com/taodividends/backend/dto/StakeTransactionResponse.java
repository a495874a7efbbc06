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
public class StakeTransactionResponse {
    private Long id;
    private String taskId;
    private int netuid;
    private String hotkey;
    private String operationType;
    private BigDecimal amount;
    private String txHash;
    private String status;
    private String error;
    private Double sentimentScore;
    private String origin;
    private Instant createdAt;
    private Instant updatedAt;
}
