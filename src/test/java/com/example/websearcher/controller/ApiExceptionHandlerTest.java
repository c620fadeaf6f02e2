package com.example.websearcher.controller;

import com.example.websearcher.service.QueryInProgressException;
import com.example.websearcher.service.ResourceUnavailableException;
import com.example.websearcher.service.SessionExpiredException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void testBadRequest_NullMessageFallsBackToReasonPhrase() {
        // When
        ResponseEntity<Map<String, Object>> response = handler.badRequest(new IllegalArgumentException());

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("detail", "Bad Request"), response.getBody());
    }

    @Test
    void testResourceUnavailable_NullMessage() {
        ResponseEntity<Map<String, Object>> response =
                handler.resourceUnavailable(new ResourceUnavailableException(null));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("Service Unavailable", response.getBody().get("detail"));
    }

    @Test
    void testStatusMapping() {
        assertEquals(HttpStatus.NOT_FOUND, handler.notFound(new SessionExpiredException("abc")).getStatusCode());
        assertEquals("Session expired", handler.notFound(new SessionExpiredException("abc")).getBody().get("detail"));
        assertEquals(HttpStatus.CONFLICT, handler.queryInProgress(new QueryInProgressException("abc")).getStatusCode());
    }
}
