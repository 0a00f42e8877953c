package com.example.compliance.orchestrator.controller;

import com.example.compliance.orchestrator.request.OperationStatusRequest;
import com.example.compliance.orchestrator.request.RegisterOperationRequest;
import com.example.compliance.orchestrator.response.OperationResponse;
import com.example.compliance.orchestrator.service.OperationLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Indexing Operations", description = "Operation ledger fed by the indexing pipeline")
public class OperationController {

    private final OperationLedgerService ledgerService;

    @Operation(summary = "Register an indexing operation for a session")
    @PostMapping("/sessions/{sessionId}/operations")
    public ResponseEntity<OperationResponse> register(@PathVariable long sessionId,
                                                      @Valid @RequestBody RegisterOperationRequest request) {
        OperationResponse body = OperationResponse.from(ledgerService.registerOperation(sessionId, request.documentName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @Operation(summary = "List the indexing operations of a session")
    @GetMapping("/sessions/{sessionId}/operations")
    public List<OperationResponse> list(@PathVariable long sessionId) {
        return ledgerService.listOperations(sessionId).stream().map(OperationResponse::from).toList();
    }

    @Operation(
            summary = "Report an operation status",
            description = "Completed and failed are final; repeating the same final status is accepted."
    )
    @PutMapping("/operations/{operationId}/status")
    public OperationResponse updateStatus(@PathVariable long operationId,
                                          @Valid @RequestBody OperationStatusRequest request) {
        return OperationResponse.from(
                ledgerService.recordOperationStatus(operationId, request.status(), request.errorMessage()));
    }
}
