package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.DispatchRecordDao;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.model.OperationTally;
import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/**
 * Grants the right to dispatch a session at most once. The unique key on
 * {@code dispatch_records.session_id} is the authority; the session row lock only makes
 * concurrent callers queue instead of racing to the constraint.
 */
@Slf4j
@Component
public class DispatchGuard {

    private final DispatchRecordDao dispatchRecordDao;
    private final ValidationSessionRepository sessionRepository;
    private final SessionAggregateDao aggregateDao;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public DispatchGuard(DispatchRecordDao dispatchRecordDao,
                         ValidationSessionRepository sessionRepository,
                         SessionAggregateDao aggregateDao,
                         ApplicationEventPublisher eventPublisher,
                         PlatformTransactionManager transactionManager) {
        this.dispatchRecordDao = dispatchRecordDao;
        this.sessionRepository = sessionRepository;
        this.aggregateDao = aggregateDao;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Records the dispatch and moves the session to {@code dispatched} in one committed
     * transaction.
     *
     * @return true for exactly one caller per session; false when another caller won, the session
     * is no longer dispatchable, not every operation has completed, or the insert failed
     */
    public boolean tryAcquireDispatch(long sessionId) {
        try {
            return Boolean.TRUE.equals(transactionTemplate.execute(status -> acquire(sessionId)));
        } catch (DuplicateKeyException e) {
            log.debug("[dispatch-guard] Session {} was already dispatched", sessionId);
            return false;
        } catch (DataAccessException | TransactionException e) {
            log.warn("[dispatch-guard] Could not record dispatch for session {}: {}", sessionId, e.getMessage());
            return false;
        }
    }

    private boolean acquire(long sessionId) {
        ValidationSessionEntity session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!SessionStatus.PRE_DISPATCH.contains(session.getStatus())) {
            log.debug("[dispatch-guard] Session {} is '{}', not dispatchable",
                    sessionId, session.getStatus().getWireValue());
            return false;
        }
        // operations registered after the caller's completion check are only visible under the lock
        OperationTally operations = aggregateDao.tallyOperations(sessionId);
        if (!operations.allCompleted()) {
            log.debug("[dispatch-guard] Session {} has {} of {} operation(s) completed, not dispatchable",
                    sessionId, operations.completed(), operations.total());
            return false;
        }

        dispatchRecordDao.insertPending(sessionId, Instant.now());
        session.setStatus(SessionStatus.DISPATCHED).setErrorMessage(null).touch();
        eventPublisher.publishEvent(new SessionStateChangedEvent(session.toSnapshot()));

        log.info("[dispatch-guard] Dispatch acquired for session {}", sessionId);
        return true;
    }
}
