package com.example.compliance.orchestrator.request;

import com.example.compliance.orchestrator.model.ResultStatus;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record UpsertResultRequest(
        @NotNull(message = "status is required") ResultStatus status,
        String evidence,
        List<String> citations
) {
}
