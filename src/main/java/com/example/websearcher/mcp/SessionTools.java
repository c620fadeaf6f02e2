package com.example.websearcher.mcp;

import com.example.websearcher.model.SessionSnapshot;
import com.example.websearcher.model.SessionState;
import com.example.websearcher.service.QueryExecutionEngine;
import com.example.websearcher.service.SessionRecord;
import com.example.websearcher.service.SessionRegistry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class SessionTools {

    private final SessionRegistry registry;
    private final QueryExecutionEngine engine;

    @Value("${app.sessions.default-timeout-minutes:30}")
    private int defaultTimeoutMinutes;

    @Value("${app.query.default-max-steps:150}")
    private int defaultMaxSteps;

    public SessionTools(SessionRegistry registry, QueryExecutionEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    @Tool(description = "Open a new browser session with an idle timeout in minutes (optional)")
    public Map<String,Object> session_create(Integer timeoutMinutes) {
        int minutes = timeoutMinutes != null ? timeoutMinutes : defaultTimeoutMinutes;
        SessionRecord record = registry.create(Duration.ofMinutes(minutes));
        return describe(record.snapshot());
    }

    @Tool(description = "Get status, progress and result of a browser session")
    public Map<String,Object> session_get(String sessionId) {
        return describe(registry.get(sessionId).snapshot());
    }

    @Tool(description = "Close a browser session")
    public Map<String,Object> session_close(String sessionId) {
        return Map.of("sessionId", sessionId, "closed", registry.close(sessionId));
    }

    @Tool(description = "Ask the web agent a question in a session; poll session_get for the result")
    public Map<String,Object> session_query(String sessionId, String question, Integer maxSteps) {
        int steps = maxSteps != null ? maxSteps : defaultMaxSteps;
        SessionState started = engine.submit(registry.get(sessionId), question, steps);
        return Map.of("sessionId", sessionId, "status", started.getStatus().getValue());
    }

    @Tool(description = "List open browser sessions")
    public Map<String,Object> session_list() {
        Map<String, Object> sessions = new LinkedHashMap<>();
        registry.snapshot().forEach((id, snapshot) -> sessions.put(id, describe(snapshot)));
        return Map.of("activeSessions", sessions.size(), "sessions", sessions);
    }

    private static Map<String,Object> describe(SessionSnapshot snapshot) {
        // HashMap, the optional fields are frequently null
        Map<String, Object> result = new HashMap<>();
        result.put("sessionId", snapshot.getId());
        result.put("status", snapshot.getStatus().getValue());
        result.put("pageUrl", snapshot.getPageUrl());
        result.put("currentQuery", snapshot.getCurrentQuery());
        result.put("currentStep", snapshot.getCurrentStep());
        result.put("currentAction", snapshot.getCurrentAction());
        result.put("result", snapshot.getResult());
        result.put("error", snapshot.getError());
        result.put("createdAt", snapshot.getCreatedAt().toString());
        result.put("lastAccessed", snapshot.getLastAccessed().toString());
        return result;
    }
}
