package com.example.compliance.orchestrator.response;

import com.example.compliance.orchestrator.entity.IndexingOperationEntity;
import com.example.compliance.orchestrator.model.OperationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        Long id,
        Long sessionId,
        String documentName,
        OperationStatus status,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {

    public static OperationResponse from(IndexingOperationEntity operation) {
        return new OperationResponse(operation.getId(), operation.getSessionId(), operation.getDocumentName(),
                operation.getStatus(), operation.getErrorMessage(), operation.getCreatedAt(),
                operation.getUpdatedAt(), operation.getCompletedAt());
    }
}
