package com.example.websearcher.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a session, safe to hand out to callers.
 */
@Value
@Builder
public class SessionSnapshot {
    String id;
    SessionStatus status;
    String currentQuery;
    Integer currentStep;
    String currentAction;
    String result;
    String error;
    Instant createdAt;
    Instant lastAccessed;
    Duration timeout;
    String pageUrl;
}
