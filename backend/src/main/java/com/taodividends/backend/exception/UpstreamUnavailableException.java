package com.taodividends.backend.exception;

/**
 * Transient collaborator failure: connection refused, timeout, 5xx, or an open circuit.
 * This is the only exception type the retries act on.
 */
public class UpstreamUnavailableException extends RuntimeException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
