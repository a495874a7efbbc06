package com.taodividends.backend.orchestrator;

import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.model.TradeTaskKind;

import java.time.Instant;

/**
 * Score recent sentiment for the subnet and stake or unstake against the hotkey accordingly.
 */
public record SentimentTradeCommand(String taskId, TradeKey key, Instant requestedAt) implements TradeTaskCommand {

    @Override
    public TradeTaskKind kind() {
        return TradeTaskKind.SENTIMENT_TRADE;
    }
}
