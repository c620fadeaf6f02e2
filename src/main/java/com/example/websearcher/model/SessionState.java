package com.example.websearcher.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of the query-related fields of a session. A record swaps whole
 * instances of this class, so status and progress are always read together.
 */
@Value
@Builder(toBuilder = true)
public class SessionState {

    SessionStatus status;
    String currentQuery;
    Integer currentStep;
    String currentAction;
    String result;
    String error;

    /** Incremented every time a query starts; progress from older queries is discarded. */
    long generation;

    public static SessionState initial() {
        return SessionState.builder()
                .status(SessionStatus.ACTIVE)
                .generation(0L)
                .build();
    }

    public SessionState startQuery(String query) {
        return SessionState.builder()
                .status(SessionStatus.PROCESSING)
                .currentQuery(query)
                .currentStep(0)
                .generation(generation + 1)
                .build();
    }

    public SessionState withProgress(int step, String action) {
        return toBuilder()
                .currentStep(step)
                .currentAction(action)
                .build();
    }

    public SessionState completed(String answer) {
        return toBuilder()
                .status(SessionStatus.COMPLETED)
                .result(answer)
                .error(null)
                .build();
    }

    public SessionState failed(String message) {
        return toBuilder()
                .status(SessionStatus.ERROR)
                .result(null)
                .error(message)
                .build();
    }
}
