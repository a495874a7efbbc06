package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendRecordResponse {
    private Long id;
    private int netuid;
    private String hotkey;
    private BigInteger dividend;
    private String source;
    private Instant observedAt;
}
