package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.model.DispatchPayload;

/**
 * The external AI workflow that validates a session's documents and later reports per-requirement
 * results back through the API.
 */
public interface ValidationWorkflowClient {

    /**
     * Starts the workflow and returns once it acknowledged the request.
     *
     * @throws com.example.compliance.orchestrator.exception.DispatchException if the workflow did
     *                                                                          not acknowledge
     */
    void startValidation(DispatchPayload payload);
}
