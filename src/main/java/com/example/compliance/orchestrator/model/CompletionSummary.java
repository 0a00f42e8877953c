package com.example.compliance.orchestrator.model;

import java.util.List;

/**
 * Result of evaluating every indexing operation of a session.
 *
 * @param allDone true iff {@code completed + failed == total} and {@code total > 0}
 * @param anyFailed true iff at least one operation failed
 */
public record CompletionSummary(
        long sessionId,
        boolean allDone,
        boolean anyFailed,
        int total,
        int completed,
        int failed,
        List<Long> failedOperationIds
) {

    public static CompletionSummary of(long sessionId, OperationTally tally, List<Long> failedOperationIds) {
        int total = tally.total();
        int completed = tally.completed();
        int failed = tally.failed();
        boolean allDone = total > 0 && completed + failed == total;
        return new CompletionSummary(sessionId, allDone, failed > 0, total, completed, failed,
                failedOperationIds == null ? List.of() : List.copyOf(failedOperationIds));
    }

    public int pending() {
        return total - completed - failed;
    }
}
