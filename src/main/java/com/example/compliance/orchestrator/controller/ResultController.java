package com.example.compliance.orchestrator.controller;

import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import com.example.compliance.orchestrator.request.UpsertResultRequest;
import com.example.compliance.orchestrator.response.RequirementResultResponse;
import com.example.compliance.orchestrator.service.ResultAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sessions/{sessionId}/results")
@RequiredArgsConstructor
@Tag(name = "Requirement Results", description = "Per-requirement results reported by the validation workflow")
public class ResultController {

    private final ResultAggregator resultAggregator;

    @Operation(summary = "List the requirement results of a session")
    @GetMapping
    public List<RequirementResultResponse> list(@PathVariable long sessionId) {
        return resultAggregator.listResults(sessionId).stream().map(RequirementResultResponse::from).toList();
    }

    @Operation(summary = "Insert or replace one requirement result", description = "Returns the recomputed session snapshot.")
    @PutMapping("/{requirementId}")
    public SessionStatusSnapshot upsert(@PathVariable long sessionId,
                                        @PathVariable String requirementId,
                                        @Valid @RequestBody UpsertResultRequest request) {
        return resultAggregator.upsertResult(sessionId, requirementId, request.status(),
                request.evidence(), request.citations());
    }

    @Operation(summary = "Delete one requirement result", description = "Returns the recomputed session snapshot.")
    @DeleteMapping("/{requirementId}")
    public SessionStatusSnapshot delete(@PathVariable long sessionId, @PathVariable String requirementId) {
        return resultAggregator.deleteResult(sessionId, requirementId);
    }

    @Operation(summary = "Signal that every requirement result was submitted")
    @PostMapping("/complete")
    public SessionStatusSnapshot complete(@PathVariable long sessionId) {
        return resultAggregator.completeSubmission(sessionId);
    }
}
