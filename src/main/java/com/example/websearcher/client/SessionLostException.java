package com.example.websearcher.client;

/**
 * The server no longer knows the session, it was closed or expired.
 */
public class SessionLostException extends RuntimeException {

    public SessionLostException(String sessionId, String detail) {
        super("Session " + sessionId + " not found or expired: " + detail);
    }
}
