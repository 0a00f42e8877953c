package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.DispatchRecordRepository;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.model.DispatchAudit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DispatchAuditService {

    private final ValidationSessionRepository sessionRepository;
    private final DispatchRecordRepository dispatchRecordRepository;
    private final SessionAggregateDao aggregateDao;

    @Transactional(readOnly = true)
    public DispatchAudit getDispatchStatus(long sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return new DispatchAudit(sessionId,
                aggregateDao.tallyOperations(sessionId),
                dispatchRecordRepository.findBySessionId(sessionId));
    }
}
