package com.example.compliance.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Session lifecycle values. The lowercase wire values are consumed by dashboards and must not be
 * renamed.
 */
public enum SessionStatus {

    PENDING("pending"),
    INDEXING("indexing"),
    DISPATCHED("dispatched"),
    VALIDATING("validating"),
    IN_PROGRESS("in_progress"),
    PARTIAL("partial"),
    COMPLETED("completed"),
    FAILED("failed");

    /** States in which indexing Operations may still be registered or may still fail the session. */
    public static final Set<SessionStatus> PRE_DISPATCH = EnumSet.of(PENDING, INDEXING);

    /** States watched by the reconciliation sweep for timeouts. */
    public static final Set<SessionStatus> AWAITING_WORKFLOW = EnumSet.of(DISPATCHED, VALIDATING, IN_PROGRESS);

    private final String wireValue;

    SessionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Session status must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SessionStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
