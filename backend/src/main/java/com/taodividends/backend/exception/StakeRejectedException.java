package com.taodividends.backend.exception;

/**
 * The chain gateway understood the stake or unstake request and refused it
 * (insufficient balance, unknown hotkey, invalid amount). Never retried.
 */
public class StakeRejectedException extends RuntimeException {
    public StakeRejectedException(String message) {
        super(message);
    }

    public StakeRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
