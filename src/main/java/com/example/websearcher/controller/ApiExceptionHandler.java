package com.example.websearcher.controller;

import com.example.websearcher.service.QueryInProgressException;
import com.example.websearcher.service.ResourceUnavailableException;
import com.example.websearcher.service.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps registry errors to HTTP statuses with a {@code {"detail": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(SessionNotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(QueryInProgressException.class)
    public ResponseEntity<Map<String, Object>> queryInProgress(QueryInProgressException e) {
        return detail(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ResourceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> resourceUnavailable(ResourceUnavailableException e) {
        logger.error("Session resources unavailable: {}", e.getMessage());
        return detail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message != null ? message : status.getReasonPhrase()));
    }
}
