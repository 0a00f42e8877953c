package com.example.compliance.orchestrator.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CreateSessionRequest(
        @NotBlank(message = "unitCode is required") String unitCode,
        String documentType,
        @PositiveOrZero(message = "expectedResultCount must not be negative") Integer expectedResultCount
) {
}
