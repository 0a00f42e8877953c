package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.DispatchRecordRepository;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.InvalidTransitionException;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.exception.ValidationException;
import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coarse session state changes that are not derived from results: creation, indexing failure,
 * workflow acknowledgement, timeouts and manual retry.
 * <p>
 * The mutating methods open their own transaction because they are also called from
 * after-commit listeners and from the dispatch executor, where no usable transaction exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

    private final ValidationSessionRepository sessionRepository;
    private final DispatchRecordRepository dispatchRecordRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public SessionStatusSnapshot startSession(String unitCode, String documentType, Integer expectedResultCount) {
        List<String> reasons = new ArrayList<>();
        if (unitCode == null || unitCode.isBlank()) {
            reasons.add("unitCode must not be blank");
        }
        if (expectedResultCount != null && expectedResultCount < 0) {
            reasons.add("expectedResultCount must not be negative");
        }
        if (!reasons.isEmpty()) {
            throw new ValidationException(reasons);
        }

        ValidationSessionEntity session = new ValidationSessionEntity()
                .setUnitCode(unitCode.trim())
                .setDocumentType(documentType)
                .setExpectedResultCount(expectedResultCount)
                .setStatus(SessionStatus.PENDING);
        session.touch();
        ValidationSessionEntity saved = sessionRepository.save(session);

        log.info("[ledger] Started session {} for unit {}", saved.getId(), saved.getUnitCode());
        return publish(saved);
    }

    @Transactional(readOnly = true)
    public SessionStatusSnapshot snapshot(long sessionId) {
        return sessionRepository.findById(sessionId)
                .map(ValidationSessionEntity::toSnapshot)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Fails a session whose indexing produced at least one failed operation. Has no effect once
     * the session left the pre-dispatch states.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failIndexing(long sessionId, List<Long> failedOperationIds) {
        String ids = failedOperationIds.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return transition(sessionId, SessionStatus.PRE_DISPATCH, SessionStatus.FAILED,
                "Indexing failed for operation(s): " + ids);
    }

    /** The workflow acknowledged the dispatch. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markValidating(long sessionId) {
        return transition(sessionId, EnumSet.of(SessionStatus.DISPATCHED), SessionStatus.VALIDATING, null);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failDispatch(long sessionId, String errorMessage) {
        return transition(sessionId, EnumSet.of(SessionStatus.DISPATCHED), SessionStatus.FAILED, errorMessage);
    }

    /**
     * Fails the session only if it is still in one of {@code from} and has not changed since
     * {@code cutoff}. The re-check happens under the row lock, so a result arriving between the
     * sweep's query and this call wins. A session that expects no results is never waiting on the
     * workflow once it acknowledged the dispatch.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failIfStale(long sessionId, Set<SessionStatus> from, Instant cutoff, String errorMessage) {
        ValidationSessionEntity session = lock(sessionId);
        if (!from.contains(session.getStatus()) || !session.getLastUpdatedAt().isBefore(cutoff)) {
            return false;
        }
        if (session.getStatus() != SessionStatus.DISPATCHED && Integer.valueOf(0).equals(session.getExpectedResultCount())) {
            log.debug("[ledger] Session {} expects no results, not timing it out", sessionId);
            return false;
        }
        apply(session, SessionStatus.FAILED, errorMessage);
        return true;
    }

    /**
     * Clears the dispatch witness of a failed session and puts it back into {@code indexing}, so the
     * completion detector can dispatch it again.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SessionStatusSnapshot resetForRetry(long sessionId) {
        ValidationSessionEntity session = lock(sessionId);
        if (session.getStatus() != SessionStatus.FAILED) {
            throw new InvalidTransitionException("Session", sessionId,
                    session.getStatus().getWireValue(), SessionStatus.INDEXING.getWireValue());
        }
        int removed = dispatchRecordRepository.deleteBySessionId(sessionId);
        log.info("[ledger] Session {} reset for retry (dispatch records removed: {})", sessionId, removed);
        return apply(session, SessionStatus.INDEXING, null);
    }

    private boolean transition(long sessionId, Set<SessionStatus> from, SessionStatus to, String errorMessage) {
        ValidationSessionEntity session = lock(sessionId);
        if (!from.contains(session.getStatus())) {
            log.debug("[ledger] Session {} is '{}', skipping move to '{}'",
                    sessionId, session.getStatus().getWireValue(), to.getWireValue());
            return false;
        }
        apply(session, to, errorMessage);
        return true;
    }

    private SessionStatusSnapshot apply(ValidationSessionEntity session, SessionStatus to, String errorMessage) {
        SessionStatus from = session.getStatus();
        session.setStatus(to).setErrorMessage(errorMessage).touch();
        if (to == SessionStatus.FAILED) {
            log.warn("[ledger] Session {} failed ({} -> {}): {}",
                    session.getId(), from.getWireValue(), to.getWireValue(), errorMessage);
        } else {
            log.info("[ledger] Session {} moved {} -> {}", session.getId(), from.getWireValue(), to.getWireValue());
        }
        return publish(session);
    }

    private ValidationSessionEntity lock(long sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private SessionStatusSnapshot publish(ValidationSessionEntity session) {
        SessionStatusSnapshot snapshot = session.toSnapshot();
        eventPublisher.publishEvent(new SessionStateChangedEvent(snapshot));
        return snapshot;
    }
}
