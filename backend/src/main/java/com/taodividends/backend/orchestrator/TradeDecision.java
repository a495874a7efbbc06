package com.taodividends.backend.orchestrator;

import com.taodividends.backend.model.StakeDirection;

import java.math.BigDecimal;

public record TradeDecision(StakeDirection direction, BigDecimal amount) {

    public static TradeDecision none() {
        return new TradeDecision(StakeDirection.NONE, BigDecimal.ZERO);
    }

    public boolean isActionable() {
        return direction != StakeDirection.NONE && amount.signum() > 0;
    }
}
