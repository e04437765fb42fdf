package com.demo.messaging.exception;

/**
 * Empty or oversized message body, self-conversation, missing idempotency key.
 */
public class ValidationException extends MessagingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "validation_failed";
    }
}
