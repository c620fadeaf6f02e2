package com.example.websearcher.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionListResponse {
    private int activeSessions;
    private Map<String, Summary> sessions;

    public static SessionListResponse from(Map<String, SessionSnapshot> snapshots) {
        Map<String, Summary> sessions = new LinkedHashMap<>();
        snapshots.forEach((id, snapshot) -> sessions.put(id, Summary.builder()
                .status(snapshot.getStatus())
                .createdAt(snapshot.getCreatedAt())
                .lastAccessed(snapshot.getLastAccessed())
                .currentQuery(snapshot.getCurrentQuery())
                .pageUrl(snapshot.getPageUrl())
                .build()));
        return new SessionListResponse(snapshots.size(), sessions);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private SessionStatus status;
        private Instant createdAt;
        private Instant lastAccessed;
        private String currentQuery;
        private String pageUrl;
    }
}
