package com.example.compliance.orchestrator.model;

/** Body posted to the validation workflow. */
public record DispatchPayload(long sessionId, int expectedRequirementCount) {
}
