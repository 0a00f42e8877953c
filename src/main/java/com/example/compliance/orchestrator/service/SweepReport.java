package com.example.compliance.orchestrator.service;

/** Counts of what one reconciliation pass changed. */
public record SweepReport(int timedOut, int resumed, int refreshed) {

    public boolean isEmpty() {
        return timedOut == 0 && resumed == 0 && refreshed == 0;
    }
}
