package com.payment.fraudcheck.emission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default collector: writes each record as one JSON line to the {@code telemetry} logger, so a log
 * shipper can forward it. Registered when no other collector is configured.
 */
public class LoggingTelemetryCollector implements TelemetryCollector {

    private static final Logger TELEMETRY = LoggerFactory.getLogger("telemetry");

    private final ObjectMapper objectMapper;

    public LoggingTelemetryCollector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "logging";
    }

    @Override
    public void exportTrace(TraceRecord trace) {
        TELEMETRY.info("trace {}", toJson(trace));
    }

    @Override
    public void exportMetrics(List<MetricRecord> metrics) {
        for (MetricRecord metric : metrics) {
            TELEMETRY.info("metric {}", toJson(metric));
        }
    }

    @Override
    public void exportLog(LogRecord record) {
        TELEMETRY.info("log {}", toJson(record));
    }

    private String toJson(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new EmissionException("Cannot serialize " + record.getClass().getSimpleName(), e);
        }
    }
}
