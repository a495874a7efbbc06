package com.taodividends.backend.controller;

import com.taodividends.backend.dto.HealthResponse;
import com.taodividends.backend.dto.WorkerHealthResponse;
import com.taodividends.backend.orchestrator.WorkerHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final WorkerHealthService workerHealthService;
    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Liveness")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("ok")
                .service("tao-dividends")
                .timestamp(Instant.now(clock))
                .build());
    }

    @GetMapping("/worker-health")
    @Operation(summary = "Trade worker pool and queue state")
    public ResponseEntity<WorkerHealthResponse> workerHealth() {
        WorkerHealthResponse snapshot = workerHealthService.snapshot();
        return "UP".equals(snapshot.getStatus())
                ? ResponseEntity.ok(snapshot)
                : ResponseEntity.status(503).body(snapshot);
    }
}
