package com.example.compliance.orchestrator.request;

import jakarta.validation.constraints.NotBlank;

public record RegisterOperationRequest(
        @NotBlank(message = "documentName is required") String documentName
) {
}
