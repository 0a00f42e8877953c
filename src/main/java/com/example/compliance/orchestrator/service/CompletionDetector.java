package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.dao.IndexingOperationRepository;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.model.CompletionSummary;
import com.example.compliance.orchestrator.model.OperationStatus;
import com.example.compliance.orchestrator.model.OperationTally;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Decides whether every indexing operation of a session has finished. Pure read: it never changes
 * session state, so it is safe to call as often as events arrive.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionDetector {

    private final SessionAggregateDao aggregateDao;
    private final IndexingOperationRepository operationRepository;

    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public CompletionSummary evaluate(long sessionId) {
        OperationTally tally = aggregateDao.tallyOperations(sessionId);
        List<Long> failedIds = tally.failed() > 0
                ? operationRepository.findIdsBySessionIdAndStatus(sessionId, OperationStatus.FAILED)
                : List.of();

        CompletionSummary summary = CompletionSummary.of(sessionId, tally, failedIds);
        log.debug("[detector] Session {}: {} total, {} completed, {} failed, allDone={}",
                sessionId, summary.total(), summary.completed(), summary.failed(), summary.allDone());
        return summary;
    }
}
