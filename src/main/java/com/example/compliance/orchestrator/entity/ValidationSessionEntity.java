package com.example.compliance.orchestrator.entity;

import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import com.example.compliance.orchestrator.persistence.converter.SessionStatusConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "validation_sessions")
public class ValidationSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "unit_code", nullable = false)
    private String unitCode;

    @Column(name = "document_type")
    private String documentType;

    @Convert(converter = SessionStatusConverter.class)
    @Column(name = "status", nullable = false)
    private SessionStatus status = SessionStatus.PENDING;

    /**
     * Number of requirement results the workflow will produce; null until known.
     */
    @Column(name = "expected_result_count")
    private Integer expectedResultCount;

    @Column(name = "observed_result_count", nullable = false)
    private int observedResultCount;

    @Column(name = "met_count", nullable = false)
    private int metCount;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "requirements_submitted", nullable = false)
    private boolean requirementsSubmitted;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "revision", nullable = false)
    private long revision;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt = Instant.now();

    /**
     * Marks the row as changed. Every mutation of a session goes through here so that
     * subscribers can order snapshots by revision. The timestamp is kept at the column's
     * microsecond precision so a snapshot taken before and after a reload is the same.
     */
    public ValidationSessionEntity touch() {
        revision++;
        lastUpdatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        return this;
    }

    public SessionStatusSnapshot toSnapshot() {
        return SessionStatusSnapshot.builder()
                .sessionId(id)
                .status(status)
                .observedCount(observedResultCount)
                .expectedCount(expectedResultCount)
                .metCount(metCount)
                .progressPercent(progressPercent)
                .lastUpdatedAt(lastUpdatedAt)
                .errorMessage(errorMessage)
                .revision(revision)
                .build();
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (lastUpdatedAt == null) {
            lastUpdatedAt = now;
        }
    }
}
