package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.model.CompletionSummary;
import com.example.compliance.orchestrator.model.OperationStatusChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Connects the ledger to dispatch: after every committed terminal operation change it asks the
 * completion detector whether the session is ready, and either fails the session or acquires and
 * starts its dispatch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationOrchestrator {

    private final CompletionDetector completionDetector;
    private final DispatchGuard dispatchGuard;
    private final ValidationDispatcher validationDispatcher;
    private final SessionLifecycleService lifecycleService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOperationStatusChanged(OperationStatusChangedEvent event) {
        if (!event.status().isTerminal()) {
            return;
        }
        try {
            evaluateSession(event.sessionId());
        } catch (RuntimeException e) {
            // the status change is committed; the reconciliation sweep re-evaluates indexing sessions
            log.error("[detector] Evaluation of session {} after operation {} failed",
                    event.sessionId(), event.operationId(), e);
        }
    }

    public CompletionSummary evaluateSession(long sessionId) {
        CompletionSummary summary = completionDetector.evaluate(sessionId);
        if (summary.anyFailed()) {
            if (lifecycleService.failIndexing(sessionId, summary.failedOperationIds())) {
                log.info("[detector] Session {} failed indexing: operations {}", sessionId, summary.failedOperationIds());
            }
            return summary;
        }
        if (!summary.allDone()) {
            log.debug("[detector] Session {} still has {} operation(s) running", sessionId, summary.pending());
            return summary;
        }
        if (dispatchGuard.tryAcquireDispatch(sessionId)) {
            validationDispatcher.dispatchAsync(sessionId);
        }
        return summary;
    }

    /**
     * Manually re-runs a failed session: drops its dispatch record and evaluates it again, which
     * dispatches it if all its operations completed.
     */
    public SessionStatusSnapshot retryValidation(long sessionId) {
        lifecycleService.resetForRetry(sessionId);
        log.info("[detector] Retrying validation of session {}", sessionId);
        evaluateSession(sessionId);
        return lifecycleService.snapshot(sessionId);
    }
}
