package com.taodividends.backend.model;

/**
 * Reason code stored on a terminal trade task.
 */
public enum TradeOutcome {
    CONFIRMED,
    NEUTRAL_SENTIMENT,
    NO_SENTIMENT_DATA,
    SENTIMENT_UNAVAILABLE,
    SUBMISSION_FAILED,
    SUBMISSION_UNCERTAIN,
    TIMED_OUT,
    INTERNAL_ERROR
}
