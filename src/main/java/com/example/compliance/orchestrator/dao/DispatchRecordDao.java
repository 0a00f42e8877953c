package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.model.DeliveryStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Conditional writes on {@code dispatch_records}. These need exact affected-row semantics, so they
 * bypass the JPA persistence context.
 */
public interface DispatchRecordDao {

    /**
     * Inserts the dispatch witness for a session in delivery state {@code pending}.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the session already has one
     */
    void insertPending(long sessionId, Instant dispatchedAt);

    /**
     * Moves a {@code pending} record to {@code delivering} and counts the attempt.
     *
     * @return true only for the single caller whose update matched
     */
    boolean claimForDelivery(long sessionId);

    Optional<DeliveryStatus> findDeliveryStatus(long sessionId);

    void markDelivered(long sessionId, Instant deliveredAt);

    void markFailed(long sessionId, String lastError);
}
