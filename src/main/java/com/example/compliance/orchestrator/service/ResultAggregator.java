package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.DispatchRecordRepository;
import com.example.compliance.orchestrator.dao.RequirementResultRepository;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.RequirementResultEntity;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.InvalidTransitionException;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.exception.ValidationException;
import com.example.compliance.orchestrator.model.ResultStatus;
import com.example.compliance.orchestrator.model.ResultTally;
import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stores per-requirement results and keeps the session's derived counters and status in step with
 * them. Each write locks the session row, changes the result set and recomputes from a fresh
 * count inside the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultAggregator {

    private final ValidationSessionRepository sessionRepository;
    private final RequirementResultRepository resultRepository;
    private final SessionAggregateDao aggregateDao;
    private final DispatchRecordRepository dispatchRecordRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Inserts or replaces the result for {@code (sessionId, requirementId)}. Replaying the same
     * result leaves the session unchanged.
     *
     * @throws InvalidTransitionException if the session has not been dispatched yet
     */
    @Transactional
    public SessionStatusSnapshot upsertResult(long sessionId, String requirementId, ResultStatus status,
                                              String evidence, List<String> citations) {
        List<String> reasons = new ArrayList<>();
        if (requirementId == null || requirementId.isBlank()) {
            reasons.add("requirementId must not be blank");
        }
        if (status == null) {
            reasons.add("status must be one of met, partial, not-met");
        }
        if (!reasons.isEmpty()) {
            throw new ValidationException(reasons);
        }
        String key = requirementId.trim();

        ValidationSessionEntity session = lock(sessionId);
        requireDispatched(session, SessionStatus.IN_PROGRESS);
        RequirementResultEntity result = resultRepository.findBySessionIdAndRequirementId(sessionId, key)
                .orElse(null);
        if (result == null) {
            Integer expected = session.getExpectedResultCount();
            if (expected != null && aggregateDao.tallyResults(sessionId).observed() >= expected) {
                throw new ValidationException("Session %d already holds all %d expected results; '%s' is not one of them"
                        .formatted(sessionId, expected, key));
            }
            result = new RequirementResultEntity()
                    .setSessionId(sessionId)
                    .setRequirementId(key);
        }

        List<String> newCitations = citations == null ? List.of() : citations.stream()
                .filter(Objects::nonNull)
                .toList();
        result.setStatus(status).setEvidence(evidence);
        if (!newCitations.equals(result.getCitations())) {
            result.setCitations(new ArrayList<>(newCitations));
        }
        resultRepository.saveAndFlush(result);

        log.debug("[aggregator] Session {} requirement {} -> {}", sessionId, key, status.getWireValue());
        return recompute(session, false);
    }

    /** Removes a result and recomputes. Deleting a result that does not exist changes nothing. */
    @Transactional
    public SessionStatusSnapshot deleteResult(long sessionId, String requirementId) {
        if (requirementId == null || requirementId.isBlank()) {
            throw new ValidationException("requirementId must not be blank");
        }
        String key = requirementId.trim();
        ValidationSessionEntity session = lock(sessionId);
        return resultRepository.findBySessionIdAndRequirementId(sessionId, key)
                .map(result -> {
                    resultRepository.delete(result);
                    resultRepository.flush();
                    log.info("[aggregator] Deleted result {} of session {}", key, sessionId);
                    return recompute(session, false);
                })
                .orElseGet(session::toSnapshot);
    }

    /**
     * The workflow reports that it sent every result. If the expected count was unknown it becomes
     * the observed count; results that never arrived count against the session.
     *
     * @throws InvalidTransitionException if the session has not been dispatched yet
     */
    @Transactional
    public SessionStatusSnapshot completeSubmission(long sessionId) {
        ValidationSessionEntity session = lock(sessionId);
        requireDispatched(session, SessionStatus.PARTIAL);
        boolean changed = !session.isRequirementsSubmitted();
        session.setRequirementsSubmitted(true);
        if (session.getExpectedResultCount() == null) {
            session.setExpectedResultCount(aggregateDao.tallyResults(sessionId).observed());
            changed = true;
        }
        log.info("[aggregator] Session {} submission complete (expected {})",
                sessionId, session.getExpectedResultCount());
        return recompute(session, changed);
    }

    /** Recomputes the derived fields from the stored results; used by the reconciliation sweep. */
    @Transactional
    public SessionStatusSnapshot recompute(long sessionId) {
        return recompute(lock(sessionId), false);
    }

    @Transactional(readOnly = true)
    public List<RequirementResultEntity> listResults(long sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return resultRepository.findBySessionIdOrderByRequirementIdAsc(sessionId);
    }

    private SessionStatusSnapshot recompute(ValidationSessionEntity session, boolean forceTouch) {
        ResultTally tally = aggregateDao.tallyResults(session.getId());
        int progress = tally.progressPercent();
        SessionStatus derived = deriveStatus(session.getStatus(), session.getExpectedResultCount(),
                session.isRequirementsSubmitted(), tally);

        boolean changed = forceTouch
                || session.getObservedResultCount() != tally.observed()
                || session.getMetCount() != tally.met()
                || session.getProgressPercent() != progress
                || session.getStatus() != derived;
        if (!changed) {
            return session.toSnapshot();
        }

        SessionStatus previous = session.getStatus();
        session.setObservedResultCount(tally.observed())
                .setMetCount(tally.met())
                .setProgressPercent(progress)
                .setStatus(derived)
                .touch();
        if (derived == SessionStatus.PARTIAL && session.getExpectedResultCount() != null
                && tally.observed() < session.getExpectedResultCount()) {
            session.setErrorMessage("%d of %d requirement results were never received"
                    .formatted(session.getExpectedResultCount() - tally.observed(), session.getExpectedResultCount()));
        }
        if (previous != derived) {
            log.info("[aggregator] Session {} moved {} -> {} ({}/{} observed, {} met)", session.getId(),
                    previous.getWireValue(), derived.getWireValue(), tally.observed(),
                    session.getExpectedResultCount(), tally.met());
        }

        SessionStatusSnapshot snapshot = session.toSnapshot();
        eventPublisher.publishEvent(new SessionStateChangedEvent(snapshot));
        return snapshot;
    }

    /**
     * Status implied by the stored results.
     * <ul>
     *   <li>{@code failed} never changes here.</li>
     *   <li>No results: {@code pending}. States before dispatch are kept, and so are
     *       {@code dispatched} and {@code validating} while results are still outstanding.</li>
     *   <li>Fewer results than expected, or expected still unknown: {@code in_progress}, unless the
     *       workflow already declared its submission complete, which makes it {@code partial}.</li>
     *   <li>All expected results present: {@code completed} if every one is met, else {@code partial}.</li>
     * </ul>
     */
    static SessionStatus deriveStatus(SessionStatus current, Integer expected, boolean submitted, ResultTally tally) {
        if (current == SessionStatus.FAILED) {
            return current;
        }
        if (tally.observed() == 0) {
            if (SessionStatus.PRE_DISPATCH.contains(current)) {
                return current;
            }
            boolean outstanding = !submitted && (expected == null || expected > 0);
            if (outstanding && (current == SessionStatus.DISPATCHED || current == SessionStatus.VALIDATING)) {
                return current;
            }
            return SessionStatus.PENDING;
        }
        if (expected == null || tally.observed() < expected) {
            return submitted && expected != null ? SessionStatus.PARTIAL : SessionStatus.IN_PROGRESS;
        }
        return tally.allMet() ? SessionStatus.COMPLETED : SessionStatus.PARTIAL;
    }

    /**
     * A session settled back to {@code pending} after dispatch still owns its dispatch record, so
     * only the record tells it apart from one that was never dispatched.
     */
    private void requireDispatched(ValidationSessionEntity session, SessionStatus target) {
        if (SessionStatus.PRE_DISPATCH.contains(session.getStatus())
                && !dispatchRecordRepository.existsBySessionId(session.getId())) {
            throw new InvalidTransitionException("Session", session.getId(),
                    session.getStatus().getWireValue(), target.getWireValue());
        }
    }

    private ValidationSessionEntity lock(long sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
