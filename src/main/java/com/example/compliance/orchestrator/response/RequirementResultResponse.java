package com.example.compliance.orchestrator.response;

import com.example.compliance.orchestrator.entity.RequirementResultEntity;
import com.example.compliance.orchestrator.model.ResultStatus;

import java.time.Instant;
import java.util.List;

public record RequirementResultResponse(
        String requirementId,
        ResultStatus status,
        String evidence,
        List<String> citations,
        Instant updatedAt
) {

    public static RequirementResultResponse from(RequirementResultEntity result) {
        return new RequirementResultResponse(result.getRequirementId(), result.getStatus(), result.getEvidence(),
                result.getCitations() == null ? List.of() : List.copyOf(result.getCitations()),
                result.getUpdatedAt());
    }
}
