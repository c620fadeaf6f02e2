package com.example.websearcher.controller;

import com.example.websearcher.model.QueryRequest;
import com.example.websearcher.model.QueryResponse;
import com.example.websearcher.model.SessionListResponse;
import com.example.websearcher.model.SessionResponse;
import com.example.websearcher.model.SessionState;
import com.example.websearcher.service.QueryExecutionEngine;
import com.example.websearcher.service.SessionNotFoundException;
import com.example.websearcher.service.SessionRecord;
import com.example.websearcher.service.SessionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionRegistry registry;
    private final QueryExecutionEngine engine;
    private final int defaultTimeoutMinutes;
    private final int defaultMaxSteps;

    public SessionController(SessionRegistry registry,
                             QueryExecutionEngine engine,
                             @Value("${app.sessions.default-timeout-minutes:30}") int defaultTimeoutMinutes,
                             @Value("${app.query.default-max-steps:150}") int defaultMaxSteps) {
        this.registry = registry;
        this.engine = engine;
        this.defaultTimeoutMinutes = defaultTimeoutMinutes;
        this.defaultMaxSteps = defaultMaxSteps;
    }

    @PostMapping
    public Mono<SessionResponse> createSession(
            @RequestParam(name = "timeout_minutes", required = false) Integer timeout) {
        int timeoutMinutes = timeout != null ? timeout : defaultTimeoutMinutes;
        return blocking(() -> {
            if (timeoutMinutes <= 0) {
                throw new IllegalArgumentException("timeout_minutes must be positive");
            }
            SessionRecord record = registry.create(Duration.ofMinutes(timeoutMinutes));
            return SessionResponse.builder()
                    .sessionId(record.getId())
                    .status(record.getState().getStatus())
                    .pageUrl(record.getPageUrl())
                    .build();
        });
    }

    @GetMapping("/{sessionId}")
    public Mono<SessionResponse> getSession(@PathVariable String sessionId) {
        return blocking(() -> SessionResponse.from(registry.get(sessionId).snapshot()));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<Map<String, Object>> closeSession(@PathVariable String sessionId) {
        return blocking(() -> {
            if (!registry.close(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            return Map.of("message", "Session closed");
        });
    }

    @PostMapping("/{sessionId}/query")
    public Mono<QueryResponse> query(@PathVariable String sessionId, @RequestBody QueryRequest request) {
        return blocking(() -> {
            if (request.getQuestion() == null || request.getQuestion().isBlank()) {
                throw new IllegalArgumentException("question is required");
            }
            int maxSteps = request.getMaxSteps() != null ? request.getMaxSteps() : defaultMaxSteps;
            SessionRecord record = registry.get(sessionId);
            SessionState started = engine.submit(record, request.getQuestion(), maxSteps);
            return QueryResponse.builder()
                    .sessionId(sessionId)
                    .status(started.getStatus())
                    .build();
        });
    }

    @GetMapping
    public Mono<SessionListResponse> listSessions() {
        return blocking(() -> SessionListResponse.from(registry.snapshot()));
    }

    // registry calls may wait on the browser
    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
