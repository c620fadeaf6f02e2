package com.example.websearcher.service;

import com.example.websearcher.model.SessionSnapshot;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory registry of browsing sessions with idle expiry.
 *
 * <p>Removal from the map is the single point that decides who releases a session's
 * resources: whichever of {@link #get}, {@link #close} or the sweep removes the entry
 * releases it, everybody else sees it as absent. Resources are always released
 * outside of any map operation.
 */
@Service
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final SessionResourceFactory resourceFactory;
    private final Clock clock;
    private final ExecutorService releaseExecutor;
    private final AtomicBoolean sweepStopped = new AtomicBoolean(false);

    @Value("${app.sessions.close-grace-ms:10000}")
    private long closeGraceMs;

    public SessionRegistry(SessionResourceFactory resourceFactory,
                           Clock clock,
                           @Qualifier("sessionReleaseExecutor") ExecutorService releaseExecutor) {
        this.resourceFactory = resourceFactory;
        this.clock = clock;
        this.releaseExecutor = releaseExecutor;
    }

    /**
     * @throws ResourceUnavailableException if the page or agent could not be created
     */
    public SessionRecord create(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Session timeout must be positive");
        }
        SessionResources resources = resourceFactory.create();

        Instant now = clock.instant();
        SessionRecord record;
        do {
            record = new SessionRecord(UUID.randomUUID().toString(), now, timeout, resources);
        } while (sessions.putIfAbsent(record.getId(), record) != null);

        logger.info("Created session {} (timeout {} min)", record.getId(), timeout.toMinutes());
        return record;
    }

    /**
     * Looks a session up and marks it as used.
     *
     * @throws SessionExpiredException if the session was idle for longer than its timeout; it is removed
     * @throws SessionNotFoundException if there is no such session
     */
    public SessionRecord get(String id) {
        Instant now = clock.instant();
        SessionRecord[] expired = new SessionRecord[1];
        SessionRecord live = sessions.computeIfPresent(id, (key, record) -> {
            if (record.isExpired(now)) {
                expired[0] = record;
                return null;
            }
            record.touch(now);
            return record;
        });

        if (expired[0] != null) {
            logger.info("Session {} expired, cleaning up", id);
            SessionRecord record = expired[0];
            releaseExecutor.execute(() -> releaseQuietly(record));
            throw new SessionExpiredException(id);
        }
        if (live == null) {
            throw new SessionNotFoundException(id);
        }
        return live;
    }

    /**
     * Removes a session and releases its page and agent.
     *
     * @return false if there was no such session
     */
    public boolean close(String id) {
        SessionRecord record = sessions.remove(id);
        if (record == null) {
            return false;
        }
        release(record);
        logger.info("Closed session {}", id);
        return true;
    }

    /**
     * Closes every session concurrently and stops the sweep. Individual failures are
     * logged, never propagated.
     */
    @PreDestroy
    public void closeAll() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        logger.info("Shutting down - closing {} sessions", ids.size());

        List<CompletableFuture<Boolean>> closing = new ArrayList<>();
        for (String id : ids) {
            closing.add(CompletableFuture.supplyAsync(() -> close(id), releaseExecutor));
        }
        int failures = 0;
        for (int i = 0; i < closing.size(); i++) {
            try {
                closing.get(i).join();
            } catch (CompletionException e) {
                failures++;
                logger.warn("Failed to close session {}: {}", ids.get(i), e.getCause().getMessage());
            }
        }
        sweepStopped.set(true);
        if (failures > 0) {
            logger.warn("{} of {} sessions failed to close cleanly", failures, ids.size());
        }
    }

    /**
     * Closes every session that is expired at the time of the scan.
     *
     * @return number of sessions removed
     */
    @Scheduled(fixedDelayString = "${app.sessions.cleanup-interval-ms:300000}",
            initialDelayString = "${app.sessions.cleanup-interval-ms:300000}")
    public int sweepExpired() {
        if (sweepStopped.get()) {
            return 0;
        }
        int removed = 0;
        try {
            Instant now = clock.instant();
            List<String> candidates = new ArrayList<>();
            sessions.forEach((id, record) -> {
                if (record.isExpired(now)) {
                    candidates.add(id);
                }
            });

            for (String id : candidates) {
                SessionRecord record = removeIfExpired(id, now);
                if (record != null) {
                    logger.info("Cleaning up expired session {}", id);
                    releaseQuietly(record);
                    removed++;
                }
            }
        } catch (RuntimeException e) {
            logger.error("Error in cleanup task", e);
        }
        return removed;
    }

    public int count() {
        return sessions.size();
    }

    /** Copies of all current sessions, keyed by id. */
    public Map<String, SessionSnapshot> snapshot() {
        Map<String, SessionSnapshot> copies = new LinkedHashMap<>();
        sessions.forEach((id, record) -> copies.put(id, record.snapshot()));
        return Collections.unmodifiableMap(copies);
    }

    // a lookup may have touched the session since the scan, so expiry is checked again
    private SessionRecord removeIfExpired(String id, Instant now) {
        SessionRecord[] removed = new SessionRecord[1];
        sessions.computeIfPresent(id, (key, record) -> {
            if (record.isExpired(now)) {
                removed[0] = record;
                return null;
            }
            return record;
        });
        return removed[0];
    }

    private void releaseQuietly(SessionRecord record) {
        try {
            release(record);
        } catch (RuntimeException e) {
            logger.error("Error cleaning up session {}: {}", record.getId(), e.getMessage());
        }
    }

    /**
     * Stops a running query and releases the resources once its loop has let go of
     * the page. If the loop does not stop within the grace period the release is
     * deferred until it does.
     */
    private void release(SessionRecord record) {
        record.markClosed();
        QueryRun run = record.getActiveRun();
        if (run != null && !run.isDone()) {
            try {
                run.await(closeGraceMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("Query in session {} still running after {}ms, releasing when it stops",
                        record.getId(), closeGraceMs);
                run.completion().thenRun(() -> releaseResources(record));
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.completion().thenRun(() -> releaseResources(record));
                return;
            }
        }
        releaseResources(record);
    }

    private void releaseResources(SessionRecord record) {
        try {
            record.getResources().release();
        } catch (RuntimeException e) {
            logger.warn("Error closing page for session {}: {}", record.getId(), e.getMessage());
        }
    }
}
