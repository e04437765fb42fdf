package com.demo.messaging.exception;

public class NotFoundException extends MessagingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException conversation(String conversationId) {
        return new NotFoundException("Conversation unavailable: " + conversationId);
    }

    @Override
    public String getCode() {
        return "not_found";
    }
}
