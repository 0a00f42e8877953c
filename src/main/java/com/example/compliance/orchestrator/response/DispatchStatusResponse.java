package com.example.compliance.orchestrator.response;

import com.example.compliance.orchestrator.entity.DispatchRecordEntity;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import com.example.compliance.orchestrator.model.DispatchAudit;
import com.example.compliance.orchestrator.model.OperationTally;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchStatusResponse(
        long sessionId,
        int totalOperations,
        int completedOperations,
        int failedOperations,
        int pendingOperations,
        boolean dispatched,
        DeliveryStatus deliveryStatus,
        Integer attemptCount,
        Instant dispatchedAt,
        Instant deliveredAt,
        String lastError
) {

    public static DispatchStatusResponse from(DispatchAudit audit) {
        OperationTally ops = audit.operations();
        int pending = ops.total() - ops.completed() - ops.failed();
        DispatchRecordEntity record = audit.record().orElse(null);
        if (record == null) {
            return new DispatchStatusResponse(audit.sessionId(), ops.total(), ops.completed(), ops.failed(), pending,
                    false, null, null, null, null, null);
        }
        return new DispatchStatusResponse(audit.sessionId(), ops.total(), ops.completed(), ops.failed(), pending,
                true, record.getDeliveryStatus(), record.getAttemptCount(), record.getDispatchedAt(),
                record.getDeliveredAt(), record.getLastError());
    }
}
