package com.taodividends.backend.model;

/**
 * Trade task lifecycle.
 * PENDING -> SCORING -> DECIDING -> SUBMITTING -> CONFIRMED, with FAILED reachable from every non-terminal state.
 */
public enum TradeTaskState {
    PENDING,     // persisted, waiting for a worker
    SCORING,     // claimed, collecting posts and scoring sentiment
    DECIDING,    // score known, choosing direction and amount
    SUBMITTING,  // stake/unstake request handed to the chain gateway
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }

    public boolean canTransitionTo(TradeTaskState target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == SCORING;
            case SCORING -> target == DECIDING;
            case DECIDING -> target == SUBMITTING;
            case SUBMITTING -> target == CONFIRMED;
            default -> false;
        };
    }
}
