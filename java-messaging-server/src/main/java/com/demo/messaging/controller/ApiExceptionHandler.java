package com.demo.messaging.controller;

import com.demo.messaging.exception.AuthenticationException;
import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.MessagingException;
import com.demo.messaging.exception.NotFoundException;
import com.demo.messaging.exception.TransientException;
import com.demo.messaging.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps the messaging error taxonomy to HTTP responses with an {error, detail} body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MessagingException.class)
    public ResponseEntity<Map<String, String>> handleMessagingException(MessagingException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.warn("Request failed: code={}, detail={}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected: code={}, detail={}", e.getCode(), e.getMessage());
        }
        return body(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler({CompletionException.class, ExecutionException.class})
    public ResponseEntity<Map<String, String>> handleWrapped(Exception e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof MessagingException) {
            return handleMessagingException((MessagingException) cause);
        }
        return handleUnexpected(cause);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "validation_failed", "Malformed request");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return body(HttpStatus.UNAUTHORIZED, "unauthenticated", "Missing " + e.getHeaderName() + " header");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        return handleUnexpected(e);
    }

    private ResponseEntity<Map<String, String>> handleUnexpected(Throwable e) {
        log.error("Unhandled error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal error");
    }

    static HttpStatus statusFor(MessagingException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof AuthenticationException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (e instanceof AuthorizationException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof TransientException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("detail", detail);
        return ResponseEntity.status(status).body(body);
    }
}
