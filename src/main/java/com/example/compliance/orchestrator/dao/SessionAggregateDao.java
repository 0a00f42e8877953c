package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.model.OperationTally;
import com.example.compliance.orchestrator.model.ResultTally;

/**
 * Aggregate reads over a session's child rows. Each method is a single SQL statement so the
 * counts it returns always describe one consistent state of the table.
 */
public interface SessionAggregateDao {

    OperationTally tallyOperations(long sessionId);

    ResultTally tallyResults(long sessionId);
}
