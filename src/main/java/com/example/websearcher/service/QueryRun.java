package com.example.websearcher.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on the background loop of one query.
 */
public class QueryRun {

    private enum Phase { PENDING, RUNNING, FINISHED }

    private final long generation;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.PENDING);
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private volatile Future<?> task;
    private volatile boolean cancelled;

    QueryRun(long generation) {
        this.generation = generation;
    }

    public long getGeneration() {
        return generation;
    }

    void bind(Future<?> future) {
        this.task = future;
        if (cancelled) {
            future.cancel(true);
        }
    }

    /** Called first thing by the loop; false if the run was cancelled before it started. */
    boolean start() {
        return phase.compareAndSet(Phase.PENDING, Phase.RUNNING);
    }

    /** Asks the loop to stop; it exits at its next step boundary or interruptible wait. */
    void cancel() {
        cancelled = true;
        if (phase.compareAndSet(Phase.PENDING, Phase.FINISHED)) {
            done.complete(null);
        }
        Future<?> future = task;
        if (future != null) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void markDone() {
        phase.set(Phase.FINISHED);
        done.complete(null);
    }

    public boolean isDone() {
        return done.isDone();
    }

    public void await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            done.get(timeout, unit);
        } catch (ExecutionException e) {
            // done is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
    }

    CompletableFuture<Void> completion() {
        return done;
    }
}
