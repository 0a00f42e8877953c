package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.util.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic repair pass. It times out sessions the workflow stopped answering for, re-evaluates
 * indexing sessions whose completion event may have been lost, and recomputes derived fields of
 * sessions still receiving results.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationSweep {

    private static final Set<SessionStatus> RECEIVING_RESULTS = EnumSet.of(SessionStatus.VALIDATING, SessionStatus.IN_PROGRESS);

    private final ValidationSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final ValidationOrchestrator orchestrator;
    private final ResultAggregator resultAggregator;
    private final RetryPolicy retryPolicy;
    private final OrchestratorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(initialDelayString = "${orchestrator.reconciliation.interval:PT1M}",
            fixedDelayString = "${orchestrator.reconciliation.interval:PT1M}")
    public void scheduledSweep() {
        if (!properties.getReconciliation().isEnabled()) {
            return;
        }
        sweep();
    }

    public SweepReport sweep() {
        if (!running.compareAndSet(false, true)) {
            log.debug("[reconciliation] Previous sweep still running");
            return new SweepReport(0, 0, 0);
        }
        try {
            SweepReport report = new SweepReport(failStuckSessions(), resumeIndexingSessions(), refreshAggregates());
            if (!report.isEmpty()) {
                log.info("[reconciliation] Timed out {}, re-evaluated {}, refreshed {} session(s)",
                        report.timedOut(), report.resumed(), report.refreshed());
            }
            return report;
        } finally {
            running.set(false);
        }
    }

    int failStuckSessions() {
        Duration timeout = properties.getReconciliation().getStuckTimeout();
        Instant cutoff = Instant.now().minus(timeout);
        List<ValidationSessionEntity> stuck = retryPolicy.execute("load stuck sessions",
                () -> sessionRepository.findByStatusInAndLastUpdatedAtBeforeOrderByLastUpdatedAtAsc(
                        SessionStatus.AWAITING_WORKFLOW, cutoff, page()));

        int failed = 0;
        for (ValidationSessionEntity session : stuck) {
            String message = "Validation timed out after %d minute(s) in status '%s'"
                    .formatted(Math.max(1, timeout.toMinutes()), session.getStatus().getWireValue());
            try {
                if (lifecycleService.failIfStale(session.getId(), SessionStatus.AWAITING_WORKFLOW, cutoff, message)) {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.warn("[reconciliation] Could not time out session {}: {}", session.getId(), e.getMessage());
            }
        }
        return failed;
    }

    int resumeIndexingSessions() {
        Instant cutoff = Instant.now().minus(properties.getReconciliation().getIndexingGrace());
        List<ValidationSessionEntity> indexing = retryPolicy.execute("load indexing sessions",
                () -> sessionRepository.findByStatusInAndLastUpdatedAtBeforeOrderByLastUpdatedAtAsc(
                        EnumSet.of(SessionStatus.INDEXING), cutoff, page()));

        int resumed = 0;
        for (ValidationSessionEntity session : indexing) {
            try {
                if (orchestrator.evaluateSession(session.getId()).allDone()) {
                    resumed++;
                }
            } catch (RuntimeException e) {
                log.warn("[reconciliation] Could not re-evaluate session {}: {}", session.getId(), e.getMessage());
            }
        }
        return resumed;
    }

    int refreshAggregates() {
        List<ValidationSessionEntity> active = retryPolicy.execute("load active sessions",
                () -> sessionRepository.findByStatusInOrderByLastUpdatedAtAsc(RECEIVING_RESULTS, page()));

        int refreshed = 0;
        for (ValidationSessionEntity session : active) {
            try {
                long before = session.getRevision();
                long after = retryPolicy.execute("recompute session " + session.getId(),
                        () -> resultAggregator.recompute(session.getId())).getRevision();
                if (after != before) {
                    refreshed++;
                }
            } catch (RuntimeException e) {
                log.warn("[reconciliation] Could not recompute session {}: {}", session.getId(), e.getMessage());
            }
        }
        return refreshed;
    }

    private PageRequest page() {
        return PageRequest.of(0, properties.getReconciliation().getBatchSize());
    }
}
