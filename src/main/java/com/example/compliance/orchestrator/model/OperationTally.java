package com.example.compliance.orchestrator.model;

/** Aggregate counts over the indexing operations of one session. */
public record OperationTally(int total, int completed, int failed) {

    public static OperationTally empty() {
        return new OperationTally(0, 0, 0);
    }

    /** At least one operation exists and every one of them completed successfully. */
    public boolean allCompleted() {
        return total > 0 && completed == total;
    }
}
