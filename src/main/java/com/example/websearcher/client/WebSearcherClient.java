package com.example.websearcher.client;

import com.example.websearcher.model.QueryRequest;
import com.example.websearcher.model.QueryResponse;
import com.example.websearcher.model.SessionListResponse;
import com.example.websearcher.model.SessionResponse;
import com.example.websearcher.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the session API. Holds the id of the session it created; a query is
 * submitted and then polled until the session reaches a terminal status.
 *
 * <p>A 404 while talking about the current session means it is gone for good: the
 * id is dropped and {@link SessionLostException} is raised.
 */
public class WebSearcherClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WebSearcherClient.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private volatile String sessionId;

    public WebSearcherClient(String baseUrl) {
        this(WebClient.builder().baseUrl(baseUrl).build());
    }

    public WebSearcherClient(WebClient webClient) {
        this.webClient = webClient;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Mono<String> createSession(int timeoutMinutes) {
        return webClient.post()
                .uri(uri -> uri.path("/sessions").queryParam("timeout_minutes", timeoutMinutes).build())
                .retrieve()
                .bodyToMono(SessionResponse.class)
                .map(response -> {
                    sessionId = response.getSessionId();
                    logger.info("Created session: {}", sessionId);
                    return sessionId;
                })
                .doOnError(e -> logger.error("Failed to create session: {}", e.getMessage()));
    }

    public Mono<SessionResponse> getSessionInfo() {
        return Mono.defer(() -> {
            String id = requireSession();
            return webClient.get()
                    .uri("/sessions/{id}", id)
                    .retrieve()
                    .bodyToMono(SessionResponse.class)
                    .onErrorMap(this::isNotFound, e -> sessionLost(id, e));
        });
    }

    /**
     * Submits a question and polls until the agent answers.
     *
     * @return the answer; empty if the agent finished without one
     */
    public Mono<String> queryAsync(String question, int maxSteps, Duration pollInterval) {
        return Mono.defer(() -> {
            String id = requireSession();
            return webClient.post()
                    .uri("/sessions/{id}/query", id)
                    .bodyValue(new QueryRequest(question, maxSteps))
                    .retrieve()
                    .bodyToMono(QueryResponse.class)
                    .onErrorMap(this::isNotFound, e -> sessionLost(id, e));
        }).flatMap(started -> {
            logger.info("Query started: {}", started.getStatus().getValue());
            long startNanos = System.nanoTime();
            return awaitTerminal(pollInterval).flatMap(info -> {
                if (info.getStatus() == SessionStatus.ERROR) {
                    String error = info.getError() != null ? info.getError() : "Unknown error";
                    logger.error("Query failed: {}", error);
                    return Mono.error(new QueryFailedException(error));
                }
                logger.info("Query completed in {} ms", Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
                return Mono.justOrEmpty(info.getResult());
            });
        });
    }

    public Mono<String> queryAsync(String question) {
        return queryAsync(question, 150, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Closes the current session. A session the server no longer knows counts as closed.
     *
     * @return false if this client has no session
     */
    public Mono<Boolean> closeSession() {
        return Mono.defer(() -> {
            String id = sessionId;
            if (id == null) {
                return Mono.just(false);
            }
            return webClient.delete()
                    .uri("/sessions/{id}", id)
                    .retrieve()
                    .toBodilessEntity()
                    .map(response -> {
                        logger.info("Session {} closed", id);
                        sessionId = null;
                        return true;
                    })
                    .onErrorResume(this::isNotFound, e -> {
                        logger.warn("Session not found (may have already expired)");
                        sessionId = null;
                        return Mono.just(true);
                    });
        });
    }

    public Mono<SessionListResponse> listSessions() {
        return webClient.get()
                .uri("/sessions")
                .retrieve()
                .bodyToMono(SessionListResponse.class)
                .doOnError(e -> logger.error("Error listing sessions: {}", e.getMessage()));
    }

    @Override
    public void close() {
        if (sessionId == null) {
            return;
        }
        try {
            closeSession().block(CLOSE_TIMEOUT);
        } catch (RuntimeException e) {
            logger.error("Error closing session on client close: {}", e.getMessage());
        }
    }

    private Mono<SessionResponse> awaitTerminal(Duration pollInterval) {
        return getSessionInfo().flatMap(info -> {
            if (info.getCurrentStep() != null && info.getCurrentStep() > 0) {
                logger.info("Step {}: {}", info.getCurrentStep(),
                        info.getCurrentAction() != null ? info.getCurrentAction() : "Processing...");
            }
            if (info.getStatus() != null && info.getStatus().isTerminal()) {
                return Mono.just(info);
            }
            logger.info("Status: {}", info.getStatus() != null ? info.getStatus().getValue() : "unknown");
            return Mono.delay(pollInterval).then(Mono.defer(() -> awaitTerminal(pollInterval)));
        });
    }

    private String requireSession() {
        String id = sessionId;
        if (id == null) {
            throw new IllegalStateException("No active session");
        }
        return id;
    }

    private boolean isNotFound(Throwable e) {
        return e instanceof WebClientResponseException
                && ((WebClientResponseException) e).getStatusCode().value() == HttpStatus.NOT_FOUND.value();
    }

    private SessionLostException sessionLost(String id, Throwable e) {
        logger.warn("Session not found or expired");
        if (id.equals(sessionId)) {
            sessionId = null;
        }
        return new SessionLostException(id, ((WebClientResponseException) e).getResponseBodyAsString());
    }
}
