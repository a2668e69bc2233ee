package com.payment.fraudcheck.emission;

import java.util.List;

/**
 * Boundary to the external observability backend. Transport, batching and retries are the
 * implementation's business; failures are reported as {@link EmissionException}.
 */
public interface TelemetryCollector {

    /** Short name for logs and stats, e.g. "logging" or "kafka". */
    String getName();

    void exportTrace(TraceRecord trace);

    void exportMetrics(List<MetricRecord> metrics);

    void exportLog(LogRecord record);
}
