package com.taodividends.backend.model;

public record DividendQuery(int netuid, String hotkey) {

    public TradeKey tradeKey() {
        return new TradeKey(netuid, hotkey);
    }
}
