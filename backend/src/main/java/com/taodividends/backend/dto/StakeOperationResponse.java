package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StakeOperationResponse {
    private int netuid;
    private String hotkey;
    private BigDecimal amount;
    private String operationType;
    private String txHash;
    private boolean success;
    private String error;
}
