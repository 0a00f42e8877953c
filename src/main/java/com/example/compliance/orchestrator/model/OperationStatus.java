package com.example.compliance.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OperationStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    OperationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /** Once terminal, an operation's status never changes again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static OperationStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation status must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OperationStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown operation status: " + value);
    }
}
