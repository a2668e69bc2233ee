package com.payment.fraudcheck.api;

import com.payment.fraudcheck.emission.EmissionSinkAdapter;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only views of the in-process metrics and emission state, plus service health.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Observability", description = "Metrics snapshot, emission stats and health")
public class MetricsController {

    private final MetricsAggregator metrics;
    private final EmissionSinkAdapter sink;

    @Value("${spring.application.name:fraud-check-tracing}")
    private String serviceName;

    @GetMapping("/api/metrics")
    @Operation(summary = "Current metrics", description = "Point-in-time snapshot of all series and outcome counts, plus telemetry emission stats.")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(Map.of(
                "metrics", metrics.snapshot(),
                "emission", sink.stats()));
    }

    @PostMapping("/api/metrics/reset")
    @Operation(summary = "Reset metrics", description = "Clears all series and outcome counts. Meant for benchmark runs.")
    public ResponseEntity<Void> reset() {
        log.info("[AUDIT] METRICS_RESET");
        metrics.reset();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "service", serviceName,
                "timestamp", Instant.now().toString(),
                "telemetry", Map.of(
                        "collector", sink.stats().getCollector(),
                        "running", sink.isRunning())));
    }
}
