package com.example.compliance.orchestrator.entity;

import com.example.compliance.orchestrator.model.ResultStatus;
import com.example.compliance.orchestrator.persistence.converter.ResultStatusConverter;
import com.example.compliance.orchestrator.persistence.converter.StringListJsonConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "requirement_results",
        uniqueConstraints = @UniqueConstraint(name = "uq_requirement_results_session_requirement",
                columnNames = {"session_id", "requirement_id"}))
public class RequirementResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "requirement_id", nullable = false)
    private String requirementId;

    @Convert(converter = ResultStatusConverter.class)
    @Column(name = "status", nullable = false)
    private ResultStatus status;

    @Column(name = "evidence", columnDefinition = "text")
    private String evidence;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "citations", columnDefinition = "text")
    private List<String> citations = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
