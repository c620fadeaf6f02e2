package com.example.websearcher.service;

/**
 * The session existed but had been idle for longer than its timeout. It has been
 * removed from the registry by the time this is thrown.
 */
public class SessionExpiredException extends SessionNotFoundException {

    public SessionExpiredException(String sessionId) {
        super(sessionId, "Session expired");
    }
}
