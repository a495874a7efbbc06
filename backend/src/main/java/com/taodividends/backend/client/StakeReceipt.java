package com.taodividends.backend.client;

public record StakeReceipt(String txHash) {
}
