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
public class TradeTaskResponse {
    private String taskId;
    private String kind;
    private int netuid;
    private String hotkey;
    private String state;
    private String outcome;
    private Double sentimentScore;
    private Integer postsCount;
    private String direction;
    private BigDecimal amount;
    private String txHash;
    private String error;
    private int attempts;
    private Instant requestedAt;
    private Instant startedAt;
    private Instant completedAt;
}
