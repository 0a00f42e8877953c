package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.DispatchRecordRepository;
import com.example.compliance.orchestrator.dao.IndexingOperationRepository;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.IndexingOperationEntity;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.InvalidTransitionException;
import com.example.compliance.orchestrator.exception.OperationNotFoundException;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.exception.ValidationException;
import com.example.compliance.orchestrator.model.OperationStatus;
import com.example.compliance.orchestrator.model.OperationStatusChangedEvent;
import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Records indexing operations and their status changes. Terminal statuses are final; a repeated
 * report of the same terminal status is accepted and ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationLedgerService {

    private final IndexingOperationRepository operationRepository;
    private final ValidationSessionRepository sessionRepository;
    private final DispatchRecordRepository dispatchRecordRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public IndexingOperationEntity registerOperation(long sessionId, String documentName) {
        if (documentName == null || documentName.isBlank()) {
            throw new ValidationException("documentName must not be blank");
        }
        ValidationSessionEntity session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!SessionStatus.PRE_DISPATCH.contains(session.getStatus())
                || dispatchRecordRepository.existsBySessionId(sessionId)) {
            throw new InvalidTransitionException("Session", sessionId,
                    session.getStatus().getWireValue(), SessionStatus.INDEXING.getWireValue());
        }

        IndexingOperationEntity operation = operationRepository.save(new IndexingOperationEntity()
                .setSessionId(sessionId)
                .setDocumentName(documentName.trim())
                .setStatus(OperationStatus.PENDING));

        if (session.getStatus() == SessionStatus.PENDING) {
            session.setStatus(SessionStatus.INDEXING).touch();
            eventPublisher.publishEvent(new SessionStateChangedEvent(session.toSnapshot()));
        }
        log.info("[ledger] Registered operation {} ({}) for session {}",
                operation.getId(), operation.getDocumentName(), sessionId);
        return operation;
    }

    /**
     * Applies a status report from the indexing pipeline. The completion check runs after this
     * transaction commits, driven by the published {@link OperationStatusChangedEvent}.
     *
     * @throws InvalidTransitionException when the operation already holds a different terminal status
     */
    @Transactional
    public IndexingOperationEntity recordOperationStatus(long operationId, OperationStatus newStatus, String errorMessage) {
        if (newStatus == null) {
            throw new ValidationException("status must not be null");
        }
        IndexingOperationEntity operation = operationRepository.findByIdForUpdate(operationId)
                .orElseThrow(() -> new OperationNotFoundException(operationId));
        OperationStatus current = operation.getStatus();

        if (current == newStatus) {
            log.debug("[ledger] Operation {} already '{}', ignoring repeat", operationId, current.getWireValue());
            return operation;
        }
        if (current.isTerminal()) {
            log.warn("[ledger] Rejected operation {} change {} -> {}",
                    operationId, current.getWireValue(), newStatus.getWireValue());
            throw new InvalidTransitionException("Operation", operationId,
                    current.getWireValue(), newStatus.getWireValue());
        }

        operation.setStatus(newStatus);
        if (newStatus.isTerminal()) {
            operation.setCompletedAt(Instant.now());
        }
        if (newStatus == OperationStatus.FAILED) {
            operation.setErrorMessage(errorMessage);
        }
        operationRepository.save(operation);

        log.info("[ledger] Operation {} of session {} moved {} -> {}",
                operationId, operation.getSessionId(), current.getWireValue(), newStatus.getWireValue());
        eventPublisher.publishEvent(new OperationStatusChangedEvent(operation.getSessionId(), operationId, newStatus));
        return operation;
    }

    @Transactional(readOnly = true)
    public List<IndexingOperationEntity> listOperations(long sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return operationRepository.findBySessionIdOrderByIdAsc(sessionId);
    }
}
