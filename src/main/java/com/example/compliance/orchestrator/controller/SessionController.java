package com.example.compliance.orchestrator.controller;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import com.example.compliance.orchestrator.request.CreateSessionRequest;
import com.example.compliance.orchestrator.response.DispatchStatusResponse;
import com.example.compliance.orchestrator.service.DispatchAuditService;
import com.example.compliance.orchestrator.service.SessionLifecycleService;
import com.example.compliance.orchestrator.service.StatusPublisher;
import com.example.compliance.orchestrator.service.ValidationOrchestrator;
import com.example.compliance.orchestrator.sse.StatusEventMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Tag(name = "Validation Sessions", description = "Session lifecycle, status snapshots and the live status stream")
public class SessionController {

    private final SessionLifecycleService lifecycleService;
    private final StatusPublisher statusPublisher;
    private final ValidationOrchestrator orchestrator;
    private final DispatchAuditService dispatchAuditService;
    private final StatusEventMapper statusEventMapper;
    private final OrchestratorProperties properties;

    @Operation(summary = "Start a validation session")
    @PostMapping
    public ResponseEntity<SessionStatusSnapshot> create(@Valid @RequestBody CreateSessionRequest request) {
        SessionStatusSnapshot snapshot = lifecycleService.startSession(
                request.unitCode(), request.documentType(), request.expectedResultCount());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
    }

    @Operation(summary = "Current status snapshot of a session")
    @GetMapping("/{sessionId}/status")
    public SessionStatusSnapshot status(@PathVariable long sessionId) {
        return statusPublisher.getStatus(sessionId);
    }

    @Operation(
            summary = "Stream status snapshots (SSE)",
            description = "Sends the current snapshot first, then every committed change as a 'status' event."
    )
    @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<?>> stream(@PathVariable long sessionId) {
        Flux<ServerSentEvent<?>> updates = statusPublisher.subscribe(sessionId)
                .map(statusEventMapper::toStatusEvent);
        Flux<ServerSentEvent<?>> heartbeats = Flux.interval(properties.getStream().getHeartbeat())
                .map(tick -> statusEventMapper.heartbeat());

        return Flux.merge(updates, heartbeats)
                .onErrorResume(SessionNotFoundException.class, ex -> Flux.just(
                        statusEventMapper.toErrorEvent("SESSION_NOT_FOUND", ex.getMessage())))
                .onErrorResume(ex -> {
                    log.error("[publisher] Status stream of session {} failed", sessionId, ex);
                    return Flux.just(statusEventMapper.toErrorEvent("INTERNAL_ERROR", "Status stream failed"));
                });
    }

    @Operation(summary = "Operation progress and dispatch record of a session")
    @GetMapping("/{sessionId}/dispatch")
    public DispatchStatusResponse dispatch(@PathVariable long sessionId) {
        return DispatchStatusResponse.from(dispatchAuditService.getDispatchStatus(sessionId));
    }

    @Operation(summary = "Retry a failed session", description = "Clears the dispatch record and re-evaluates indexing.")
    @PostMapping("/{sessionId}/retry")
    public SessionStatusSnapshot retry(@PathVariable long sessionId) {
        return orchestrator.retryValidation(sessionId);
    }
}
