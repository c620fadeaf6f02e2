package com.example.websearcher.service;

import com.example.websearcher.agent.DecisionGraph;
import com.example.websearcher.browser.BrowsingContext;
import com.example.websearcher.model.SessionSnapshot;
import com.example.websearcher.model.SessionState;
import com.example.websearcher.model.SessionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * One browsing session. Identity, creation time and timeout never change; the query
 * fields live in an immutable {@link SessionState} that is replaced atomically.
 */
public class SessionRecord {

    private final String id;
    private final Instant createdAt;
    private final Duration timeout;
    private final SessionResources resources;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.initial());
    private final AtomicReference<Instant> lastAccessed;
    private final AtomicReference<QueryRun> activeRun = new AtomicReference<>();
    private volatile boolean closed;

    SessionRecord(String id, Instant createdAt, Duration timeout, SessionResources resources) {
        this.id = id;
        this.createdAt = createdAt;
        this.timeout = timeout;
        this.resources = resources;
        this.lastAccessed = new AtomicReference<>(createdAt);
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Instant getLastAccessed() {
        return lastAccessed.get();
    }

    public SessionState getState() {
        return state.get();
    }

    public BrowsingContext getBrowsingContext() {
        return resources.getBrowsingContext();
    }

    public DecisionGraph getDecisionGraph() {
        return resources.getDecisionGraph();
    }

    SessionResources getResources() {
        return resources;
    }

    public String getPageUrl() {
        return resources.getBrowsingContext().url();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isExpired(Instant now) {
        return Duration.between(lastAccessed.get(), now).compareTo(timeout) > 0;
    }

    /** Moves last access forward; never backwards. */
    void touch(Instant now) {
        lastAccessed.accumulateAndGet(now, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    /**
     * Switches the session to {@code processing} for a new query.
     *
     * @throws QueryInProgressException if a query is already processing
     */
    SessionState beginQuery(String query) {
        while (true) {
            SessionState current = state.get();
            if (current.getStatus() == SessionStatus.PROCESSING) {
                throw new QueryInProgressException(id);
            }
            SessionState next = current.startQuery(query);
            if (state.compareAndSet(current, next)) {
                return next;
            }
        }
    }

    /**
     * Applies an update made by the loop of query {@code generation}. Ignored once the
     * session is closed or a newer query has started.
     *
     * @return whether the update was applied
     */
    boolean update(long generation, UnaryOperator<SessionState> change) {
        while (true) {
            SessionState current = state.get();
            if (closed || current.getGeneration() != generation) {
                return false;
            }
            if (state.compareAndSet(current, change.apply(current))) {
                return true;
            }
        }
    }

    void attachRun(QueryRun run) {
        activeRun.set(run);
    }

    QueryRun getActiveRun() {
        return activeRun.get();
    }

    /** Detaches the record and signals a running query loop to stop. */
    void markClosed() {
        closed = true;
        QueryRun run = activeRun.get();
        if (run != null) {
            run.cancel();
        }
    }

    public SessionSnapshot snapshot() {
        SessionState current = state.get();
        return SessionSnapshot.builder()
                .id(id)
                .status(current.getStatus())
                .currentQuery(current.getCurrentQuery())
                .currentStep(current.getCurrentStep())
                .currentAction(current.getCurrentAction())
                .result(current.getResult())
                .error(current.getError())
                .createdAt(createdAt)
                .lastAccessed(lastAccessed.get())
                .timeout(timeout)
                .pageUrl(getPageUrl())
                .build();
    }

    @Override
    public String toString() {
        return "SessionRecord{id=" + id + ", status=" + state.get().getStatus() + "}";
    }
}
