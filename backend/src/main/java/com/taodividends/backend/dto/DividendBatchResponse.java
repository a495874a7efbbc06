package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendBatchResponse {
    private int netuid;
    private List<DividendResponse> dividends;
    private boolean cached;
    private boolean stakeTxTriggered;
    private BigInteger totalDividend;
}
