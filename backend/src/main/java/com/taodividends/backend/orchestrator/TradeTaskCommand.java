package com.taodividends.backend.orchestrator;

import com.taodividends.backend.model.TradeKey;
import com.taodividends.backend.model.TradeTaskKind;

import java.time.Instant;

/**
 * A unit of background work for the trade orchestrator. The set of kinds is closed.
 */
public sealed interface TradeTaskCommand permits SentimentTradeCommand {

    String taskId();

    TradeKey key();

    Instant requestedAt();

    TradeTaskKind kind();
}
