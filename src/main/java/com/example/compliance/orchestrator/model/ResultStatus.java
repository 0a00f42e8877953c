package com.example.compliance.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one requirement. Older workflow versions send {@code not_met}; it is accepted and
 * stored as {@code not-met}.
 */
public enum ResultStatus {

    MET("met"),
    PARTIAL("partial"),
    NOT_MET("not-met");

    private final String wireValue;

    ResultStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ResultStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Result status must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (ResultStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown result status: " + value);
    }
}
