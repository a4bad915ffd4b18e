package com.fourinarow.game;

/**
 * The session id is unknown, or the session was already removed. Usually a
 * harmless race with a forfeit or with post-game cleanup.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
