package com.example.compliance.orchestrator.exception;

/** The validation workflow could not be started. */
public class DispatchException extends RuntimeException {

    private final boolean transientFailure;

    public DispatchException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public DispatchException(String message, boolean transientFailure) {
        this(message, transientFailure, null);
    }

    /** True when another attempt might succeed (network errors, 5xx, 429). */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
