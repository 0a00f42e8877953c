package com.example.compliance.orchestrator.model;

/** Published in the transaction that changed a session row, carrying the row's final state. */
public record SessionStateChangedEvent(SessionStatusSnapshot snapshot) {

    public long sessionId() {
        return snapshot.getSessionId();
    }
}
