package com.example.websearcher.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionResponse {
    private String sessionId;
    private SessionStatus status;
    private String pageUrl;
    private String currentQuery;
    private String result;
    private String error;
    private Integer currentStep;
    private String currentAction;

    public static SessionResponse from(SessionSnapshot snapshot) {
        return SessionResponse.builder()
                .sessionId(snapshot.getId())
                .status(snapshot.getStatus())
                .pageUrl(snapshot.getPageUrl())
                .currentQuery(snapshot.getCurrentQuery())
                .result(snapshot.getResult())
                .error(snapshot.getError())
                .currentStep(snapshot.getCurrentStep())
                .currentAction(snapshot.getCurrentAction())
                .build();
    }
}
