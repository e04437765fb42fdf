package com.demo.messaging.exception;

/**
 * Caller is not a participant of the referenced conversation, or acts on
 * behalf of another user.
 */
public class AuthorizationException extends MessagingException {

    public AuthorizationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "forbidden";
    }
}
