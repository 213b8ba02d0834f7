package com.hydralog.backend.logging.error;

import java.util.Map;

public final class SessionNotFoundException extends LoggingException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() { return sessionId; }

    @Override
    public ErrorKind kind() { return ErrorKind.SESSION_NOT_FOUND; }

    @Override
    public Map<String, Object> context() {
        return Map.of("sessionId", sessionId);
    }
}
