package com.demo.messaging.exception;

/**
 * Missing, malformed or expired identity token.
 */
public class AuthenticationException extends MessagingException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "unauthenticated";
    }
}
