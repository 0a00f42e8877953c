package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.config.DispatchConfig;
import com.example.compliance.orchestrator.dao.DispatchRecordDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import com.example.compliance.orchestrator.model.DispatchPayload;
import com.example.compliance.orchestrator.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Delivers an acquired dispatch to the validation workflow. Delivery starts from the pending
 * {@code dispatch_records} row, so a dispatch interrupted by a crash is picked up again by
 * {@link DispatchOutboxWorker}.
 */
@Slf4j
@Service
public class ValidationDispatcher {

    private final ValidationWorkflowClient workflowClient;
    private final DispatchRecordDao dispatchRecordDao;
    private final ValidationSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final RetryPolicy retryPolicy;
    private final TaskExecutor dispatchExecutor;
    private final TransactionTemplate transactionTemplate;

    public ValidationDispatcher(ValidationWorkflowClient workflowClient,
                                DispatchRecordDao dispatchRecordDao,
                                ValidationSessionRepository sessionRepository,
                                SessionLifecycleService lifecycleService,
                                RetryPolicy retryPolicy,
                                @Qualifier(DispatchConfig.DISPATCH_EXECUTOR) TaskExecutor dispatchExecutor,
                                PlatformTransactionManager transactionManager) {
        this.workflowClient = workflowClient;
        this.dispatchRecordDao = dispatchRecordDao;
        this.sessionRepository = sessionRepository;
        this.lifecycleService = lifecycleService;
        this.retryPolicy = retryPolicy;
        this.dispatchExecutor = dispatchExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Hands the delivery to the dispatch executor. If the executor refuses it, the pending record
     * stays behind for the outbox relay.
     */
    public void dispatchAsync(long sessionId) {
        try {
            dispatchExecutor.execute(() -> {
                try {
                    dispatch(sessionId);
                } catch (RuntimeException e) {
                    log.error("[dispatcher] Delivery for session {} aborted", sessionId, e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[dispatcher] Executor rejected session {}; leaving it to the outbox relay", sessionId);
        }
    }

    /**
     * Claims the pending dispatch record for {@code sessionId} and calls the workflow.
     *
     * @return true if this call delivered the dispatch; false if the record was not pending or
     * delivery failed
     */
    public boolean dispatch(long sessionId) {
        AtomicInteger claimAttempts = new AtomicInteger();
        boolean claimed = retryPolicy.execute("claim dispatch of session " + sessionId, () -> {
            claimAttempts.incrementAndGet();
            return inNewTransaction(() -> dispatchRecordDao.claimForDelivery(sessionId));
        });
        if (!claimed) {
            if (claimAttempts.get() > 1) {
                warnIfClaimLost(sessionId);
            }
            return false;
        }

        try {
            DispatchPayload payload = retryPolicy.execute("load session " + sessionId,
                    () -> inNewTransaction(() -> buildPayload(sessionId)));
            retryPolicy.run("start validation workflow for session " + sessionId,
                    () -> workflowClient.startValidation(payload));
        } catch (RuntimeException e) {
            recordFailure(sessionId, "Failed to start validation workflow: " + e.getMessage(), e);
            return false;
        }

        retryPolicy.run("record delivery of session " + sessionId,
                () -> inNewTransaction(() -> {
                    dispatchRecordDao.markDelivered(sessionId, Instant.now());
                    return Boolean.TRUE;
                }));
        lifecycleService.markValidating(sessionId);
        log.info("[dispatcher] Validation workflow started for session {}", sessionId);
        return true;
    }

    /**
     * A retried claim that matches nothing may mean an earlier attempt committed before its
     * acknowledgement was lost. The record then sits in {@code delivering} with nobody sending it.
     */
    private void warnIfClaimLost(long sessionId) {
        DeliveryStatus status = inNewTransaction(() -> dispatchRecordDao.findDeliveryStatus(sessionId).orElse(null));
        if (status == DeliveryStatus.DELIVERING) {
            log.warn("[dispatcher] Dispatch of session {} is 'delivering' after a retried claim; "
                    + "it is not being delivered and will time out unless retried", sessionId);
        }
    }

    private DispatchPayload buildPayload(long sessionId) {
        ValidationSessionEntity session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        int expected = session.getExpectedResultCount() == null ? 0 : session.getExpectedResultCount();
        return new DispatchPayload(sessionId, expected);
    }

    private void recordFailure(long sessionId, String message, RuntimeException cause) {
        log.error("[dispatcher] {} (session {})", message, sessionId, cause);
        inNewTransaction(() -> {
            dispatchRecordDao.markFailed(sessionId, message);
            return Boolean.TRUE;
        });
        lifecycleService.failDispatch(sessionId, message);
    }

    private <T> T inNewTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
