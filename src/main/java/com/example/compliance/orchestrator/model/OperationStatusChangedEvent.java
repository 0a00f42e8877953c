package com.example.compliance.orchestrator.model;

/** Published by the operation ledger whenever an operation's stored status changes. */
public record OperationStatusChangedEvent(long sessionId, long operationId, OperationStatus status) {
}
