package com.example.compliance.orchestrator.exception;

/**
 * A state change the lifecycle forbids, such as re-marking a terminal operation. It points at a
 * bug in the calling collaborator and is never retried.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String entity;
    private final long entityId;
    private final String from;
    private final String to;

    public InvalidTransitionException(String entity, long entityId, String from, String to) {
        super("%s %d cannot move from '%s' to '%s'".formatted(entity, entityId, from, to));
        this.entity = entity;
        this.entityId = entityId;
        this.from = from;
        this.to = to;
    }

    public String getEntity() {
        return entity;
    }

    public long getEntityId() {
        return entityId;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
