package com.example.websearcher.service;

public class QueryInProgressException extends RuntimeException {

    private final String sessionId;

    public QueryInProgressException(String sessionId) {
        super("A query is already running in session " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
