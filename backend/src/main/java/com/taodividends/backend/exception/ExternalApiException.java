package com.taodividends.backend.exception;

/**
 * A collaborator answered, but with a client error or a body we could not use.
 */
public class ExternalApiException extends RuntimeException {
    private final int statusCode;

    public ExternalApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public ExternalApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ExternalApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
