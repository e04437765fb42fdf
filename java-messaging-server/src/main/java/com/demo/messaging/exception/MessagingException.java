package com.demo.messaging.exception;

/**
 * Base of the messaging error taxonomy.
 *
 * Idempotency and uniqueness conflicts are not part of it: the stores absorb
 * them by returning the already persisted row.
 */
public abstract class MessagingException extends RuntimeException {

    protected MessagingException(String message) {
        super(message);
    }

    protected MessagingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable code used in API error bodies.
     */
    public abstract String getCode();

    public boolean isRetryable() {
        return false;
    }
}
