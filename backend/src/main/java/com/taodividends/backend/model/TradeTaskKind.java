package com.taodividends.backend.model;

public enum TradeTaskKind {
    SENTIMENT_TRADE
}
