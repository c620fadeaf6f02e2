package com.example.websearcher.mcp;

import com.example.websearcher.model.SessionSnapshot;
import com.example.websearcher.model.SessionState;
import com.example.websearcher.model.SessionStatus;
import com.example.websearcher.service.QueryExecutionEngine;
import com.example.websearcher.service.QueryInProgressException;
import com.example.websearcher.service.SessionNotFoundException;
import com.example.websearcher.service.SessionRecord;
import com.example.websearcher.service.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionToolsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private SessionRegistry registry;

    @Mock
    private QueryExecutionEngine engine;

    @Mock
    private SessionRecord record;

    @Mock
    private ExecutorService queryExecutor;

    private SessionTools sessionTools;

    @BeforeEach
    void setUp() {
        sessionTools = new SessionTools(registry, engine);
        ReflectionTestUtils.setField(sessionTools, "defaultTimeoutMinutes", 30);
        ReflectionTestUtils.setField(sessionTools, "defaultMaxSteps", 150);
    }

    @Test
    void testSessionCreate_DefaultTimeout() {
        // Given
        when(registry.create(Duration.ofMinutes(30))).thenReturn(record);
        when(record.snapshot()).thenReturn(snapshot("abc", SessionStatus.ACTIVE));

        // When
        Map<String, Object> result = sessionTools.session_create(null);

        // Then
        assertEquals("abc", result.get("sessionId"));
        assertEquals("active", result.get("status"));
        assertNull(result.get("result"));
        assertEquals(NOW.toString(), result.get("createdAt"));
    }

    @Test
    void testSessionCreate_ExplicitTimeout() {
        when(registry.create(Duration.ofMinutes(5))).thenReturn(record);
        when(record.snapshot()).thenReturn(snapshot("abc", SessionStatus.ACTIVE));

        sessionTools.session_create(5);

        verify(registry).create(Duration.ofMinutes(5));
    }

    @Test
    void testSessionCreate_NonPositiveTimeoutRejected() {
        // Given
        when(registry.create(Duration.ofMinutes(-5)))
                .thenThrow(new IllegalArgumentException("Session timeout must be positive"));

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> sessionTools.session_create(-5));
        verify(registry, never()).create(Duration.ofMinutes(30));
    }

    @Test
    void testSessionQuery_MissingQuestionRejected() {
        // Given
        SessionTools tools = new SessionTools(registry, new QueryExecutionEngine(queryExecutor));
        ReflectionTestUtils.setField(tools, "defaultMaxSteps", 150);
        when(registry.get("abc")).thenReturn(record);

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> tools.session_query("abc", null, null));
        assertThrows(IllegalArgumentException.class, () -> tools.session_query("abc", " ", null));
        verifyNoInteractions(queryExecutor, record);
    }

    @Test
    void testSessionQuery_SubmitsWithDefaultSteps() {
        // Given
        when(registry.get("abc")).thenReturn(record);
        when(engine.submit(record, "who won?", 150)).thenReturn(SessionState.initial().startQuery("who won?"));

        // When
        Map<String, Object> result = sessionTools.session_query("abc", "who won?", null);

        // Then
        assertEquals("abc", result.get("sessionId"));
        assertEquals("processing", result.get("status"));
    }

    @Test
    void testSessionQuery_PropagatesInProgress() {
        when(registry.get("abc")).thenReturn(record);
        when(engine.submit(record, "q", 10)).thenThrow(new QueryInProgressException("abc"));

        assertThrows(QueryInProgressException.class, () -> sessionTools.session_query("abc", "q", 10));
    }

    @Test
    void testSessionGet_UnknownSession() {
        when(registry.get("missing")).thenThrow(new SessionNotFoundException("missing"));

        assertThrows(SessionNotFoundException.class, () -> sessionTools.session_get("missing"));
    }

    @Test
    void testSessionClose() {
        when(registry.close("abc")).thenReturn(true);
        when(registry.close("gone")).thenReturn(false);

        assertEquals(true, sessionTools.session_close("abc").get("closed"));
        assertEquals(false, sessionTools.session_close("gone").get("closed"));
    }

    @Test
    void testSessionList() {
        // Given
        when(registry.snapshot()).thenReturn(Map.of(
                "a", snapshot("a", SessionStatus.COMPLETED),
                "b", snapshot("b", SessionStatus.PROCESSING)));

        // When
        Map<String, Object> result = sessionTools.session_list();

        // Then
        assertEquals(2, result.get("activeSessions"));
        Map<?, ?> sessions = assertInstanceOf(Map.class, result.get("sessions"));
        assertEquals("completed", assertInstanceOf(Map.class, sessions.get("a")).get("status"));
        assertEquals("processing", assertInstanceOf(Map.class, sessions.get("b")).get("status"));
    }

    private static SessionSnapshot snapshot(String id, SessionStatus status) {
        return SessionSnapshot.builder()
                .id(id)
                .status(status)
                .createdAt(NOW)
                .lastAccessed(NOW)
                .timeout(Duration.ofMinutes(30))
                .build();
    }
}
