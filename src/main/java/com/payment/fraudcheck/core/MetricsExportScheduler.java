package com.payment.fraudcheck.core;

import com.payment.fraudcheck.emission.EmissionSinkAdapter;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pushes a metrics snapshot to the collector on a fixed delay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsExportScheduler {

    private final MetricsAggregator metrics;
    private final EmissionSinkAdapter sink;

    @Scheduled(initialDelayString = "${fraudcheck.metrics.export-interval-ms:60000}",
            fixedDelayString = "${fraudcheck.metrics.export-interval-ms:60000}")
    public void export() {
        log.debug("Exporting metrics snapshot");
        sink.emit(metrics.snapshot());
    }
}
