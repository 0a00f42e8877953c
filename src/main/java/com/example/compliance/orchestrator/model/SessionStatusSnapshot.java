package com.example.compliance.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a session as served to dashboards. Every field is copied from a single
 * committed session row, so counts and progress always belong together.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatusSnapshot {

    long sessionId;
    SessionStatus status;
    int observedCount;
    Integer expectedCount;
    int metCount;
    int progressPercent;
    Instant lastUpdatedAt;
    String errorMessage;
    long revision;
}
