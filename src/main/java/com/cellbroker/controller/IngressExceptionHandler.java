package com.cellbroker.controller;

import com.cellbroker.exception.EventFormatException;
import com.cellbroker.exception.IncompleteConfigException;
import com.cellbroker.exception.MalformedKeyException;
import com.cellbroker.exception.PublishException;
import com.cellbroker.exception.TenantNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps ingress failures to status codes.
 *
 *   tenant unknown or not ready yet → 404
 *   bad path or bad event           → 400
 *   decouple queue publish failed   → 500
 */
@RestControllerAdvice(assignableTypes = IngressController.class)
@Slf4j
public class IngressExceptionHandler {

    @ExceptionHandler({TenantNotFoundException.class, IncompleteConfigException.class})
    public ResponseEntity<Map<String, String>> handleNotReady(RuntimeException e) {
        log.debug("Tenant not ready: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({MalformedKeyException.class, EventFormatException.class})
    public ResponseEntity<Map<String, String>> handleMalformed(Exception e) {
        log.debug("Rejected malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<Map<String, String>> handlePublish(PublishException e) {
        log.error("Failed to publish event to decouple queue: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, Exception e) {
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getMessage() == null ? status.getReasonPhrase() : e.getMessage()));
    }
}
