package com.taodividends.backend.model;

/**
 * Identity of the account a trade acts on. At most one trade per key is in flight.
 */
public record TradeKey(int netuid, String hotkey) {

    public String lockKey() {
        return netuid + ":" + hotkey;
    }
}
