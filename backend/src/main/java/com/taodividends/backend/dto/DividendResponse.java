package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendResponse {
    private int netuid;
    private String hotkey;
    private BigInteger dividend;
    private boolean cached;
    private boolean stakeTxTriggered;
    // Always null here; the trade settles in the background, see the trade task.
    private String txHash;
    private String taskId;
}
