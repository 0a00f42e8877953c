package com.example.compliance.orchestrator.exception;

public class OperationNotFoundException extends RuntimeException {

    public OperationNotFoundException(long operationId) {
        super("Operation %d not found".formatted(operationId));
    }
}
