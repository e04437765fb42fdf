package com.demo.messaging.service;

import com.demo.messaging.domain.ValidationResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Normalizes and checks message bodies before they reach the log.
 */
@Component
public class MessageBodyValidator {

    private final int maxLength;

    public MessageBodyValidator(@Value("${messaging.message.max-length:1000}") int maxLength) {
        this.maxLength = maxLength;
    }

    public ValidationResult validate(String body) {
        if (body == null) {
            return ValidationResult.failure("Message body is required");
        }
        String normalized = body.strip();
        if (normalized.isEmpty()) {
            return ValidationResult.failure("Message body must not be empty");
        }
        // Characters are code points, so a surrogate pair counts once
        int length = normalized.codePointCount(0, normalized.length());
        if (length > maxLength) {
            return ValidationResult.failure(
                "Message body exceeds " + maxLength + " characters (" + length + ")");
        }
        return ValidationResult.success(normalized);
    }
}
