package com.example.compliance.orchestrator.request;

import com.example.compliance.orchestrator.model.OperationStatus;
import jakarta.validation.constraints.NotNull;

public record OperationStatusRequest(
        @NotNull(message = "status is required") OperationStatus status,
        String errorMessage
) {
}
