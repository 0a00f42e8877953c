package com.example.compliance.orchestrator.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(long sessionId) {
        super("Session %d not found".formatted(sessionId));
    }
}
