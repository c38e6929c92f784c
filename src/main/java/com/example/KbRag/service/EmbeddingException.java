package com.example.KbRag.service;

/**
 * Raised when a text could not be embedded, either because retries ran out
 * or because the provider rejected the request outright.
 */
public class EmbeddingException extends RuntimeException {

    private final boolean rateLimited;

    public EmbeddingException(String message, Throwable cause, boolean rateLimited) {
        super(message, cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
