package com.example.compliance.orchestrator.controller;

import com.example.compliance.orchestrator.service.StatusPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final StatusPublisher statusPublisher;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = Map.of(
                "status", "up",
                "statusSubscriptions", statusPublisher.activeSubscriptions());
        return Mono.just(ResponseEntity.ok(body));
    }
}
