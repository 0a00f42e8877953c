package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.dao.DispatchRecordRepository;
import com.example.compliance.orchestrator.entity.DispatchRecordEntity;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relays dispatch records that were acquired but never claimed for delivery, e.g. because the
 * process stopped between the guard commit and the workflow call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchOutboxWorker {

    private final DispatchRecordRepository dispatchRecordRepository;
    private final ValidationDispatcher validationDispatcher;
    private final OrchestratorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(initialDelayString = "${orchestrator.dispatch.outbox-interval:PT30S}",
            fixedDelayString = "${orchestrator.dispatch.outbox-interval:PT30S}")
    public void scheduledRelay() {
        if (!properties.getDispatch().isOutboxEnabled()) {
            return;
        }
        relayPending();
    }

    /**
     * @return number of dispatches delivered in this pass
     */
    public int relayPending() {
        if (!running.compareAndSet(false, true)) {
            return 0;
        }
        try {
            OrchestratorProperties.Dispatch config = properties.getDispatch();
            Instant cutoff = Instant.now().minus(config.getOutboxGrace());
            List<DispatchRecordEntity> stale = dispatchRecordRepository
                    .findByDeliveryStatusAndDispatchedAtBeforeOrderByDispatchedAtAsc(
                            DeliveryStatus.PENDING, cutoff, PageRequest.of(0, config.getOutboxBatchSize()));
            if (stale.isEmpty()) {
                return 0;
            }

            int delivered = 0;
            for (DispatchRecordEntity record : stale) {
                try {
                    if (validationDispatcher.dispatch(record.getSessionId())) {
                        delivered++;
                    }
                } catch (RuntimeException e) {
                    log.error("[outbox] Relay of session {} failed", record.getSessionId(), e);
                }
            }
            log.info("[outbox] Relayed {}/{} pending dispatches", delivered, stale.size());
            return delivered;
        } catch (DataAccessException e) {
            log.warn("[outbox] Could not read pending dispatches: {}", e.getMessage());
            return 0;
        } finally {
            running.set(false);
        }
    }
}
