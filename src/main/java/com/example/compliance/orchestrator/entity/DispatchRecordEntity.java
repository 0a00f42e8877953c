package com.example.compliance.orchestrator.entity;

import com.example.compliance.orchestrator.model.DeliveryStatus;
import com.example.compliance.orchestrator.persistence.converter.DeliveryStatusConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Witness that the validation workflow was started for a session. The unique constraint on
 * {@code session_id} is what makes dispatch happen at most once; rows are inserted only by
 * {@code JdbcDispatchRecordDao}.
 */
@Data
@Accessors(chain = true)
@Entity
@Table(name = "dispatch_records")
public class DispatchRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true)
    private Long sessionId;

    @Convert(converter = DeliveryStatusConverter.class)
    @Column(name = "delivery_status", nullable = false)
    private DeliveryStatus deliveryStatus;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "dispatched_at", nullable = false)
    private Instant dispatchedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;
}
