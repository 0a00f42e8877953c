package com.example.compliance.orchestrator.model;

/** Aggregate counts over the requirement results of one session. */
public record ResultTally(int observed, int met, int partial, int notMet) {

    public static ResultTally empty() {
        return new ResultTally(0, 0, 0, 0);
    }

    /** {@code round(met / observed * 100)}, or 0 without results. */
    public int progressPercent() {
        if (observed <= 0) {
            return 0;
        }
        return (int) Math.round(met * 100.0 / observed);
    }

    public boolean allMet() {
        return observed > 0 && met == observed;
    }
}
