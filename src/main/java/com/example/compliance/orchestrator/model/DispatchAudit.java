package com.example.compliance.orchestrator.model;

import com.example.compliance.orchestrator.entity.DispatchRecordEntity;

import java.util.Optional;

/** Operation progress of a session next to its dispatch record, if one exists. */
public record DispatchAudit(long sessionId, OperationTally operations, Optional<DispatchRecordEntity> record) {
}
