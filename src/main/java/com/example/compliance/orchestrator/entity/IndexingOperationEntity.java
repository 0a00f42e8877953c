package com.example.compliance.orchestrator.entity;

import com.example.compliance.orchestrator.model.OperationStatus;
import com.example.compliance.orchestrator.persistence.converter.OperationStatusConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "indexing_operations")
public class IndexingOperationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "document_name", nullable = false)
    private String documentName;

    @Convert(converter = OperationStatusConverter.class)
    @Column(name = "status", nullable = false)
    private OperationStatus status = OperationStatus.PENDING;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
