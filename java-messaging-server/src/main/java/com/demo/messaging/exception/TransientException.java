package com.demo.messaging.exception;

/**
 * Network failure, timeout or unavailable dependency. Retried with backoff
 * before it reaches the user.
 */
public class TransientException extends MessagingException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "unavailable";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
