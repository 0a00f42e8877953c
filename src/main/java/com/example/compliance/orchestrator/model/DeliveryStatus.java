package com.example.compliance.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Delivery state of the dispatch intent carried by a dispatch record. */
public enum DeliveryStatus {

    PENDING,
    DELIVERING,
    DELIVERED,
    FAILED;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeliveryStatus fromWire(String value) {
        return DeliveryStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
