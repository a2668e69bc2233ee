package com.payment.fraudcheck.emission;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes telemetry to Kafka topics for the observability backend to ingest. Traces and logs are keyed
 * by trace id so all records of one request land on the same partition.
 * <p>
 * Runs on the emission dispatcher thread, so waiting for the broker acknowledgement here never delays a
 * fraud check; it lets broker failures surface as {@link EmissionException}s and be counted.
 */
@Slf4j
public class KafkaTelemetryCollector implements TelemetryCollector {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String tracesTopic;
    private final String metricsTopic;
    private final String logsTopic;
    private final long sendTimeoutMs;

    public KafkaTelemetryCollector(KafkaTemplate<String, Object> kafkaTemplate, String tracesTopic,
                                   String metricsTopic, String logsTopic, long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.tracesTopic = tracesTopic;
        this.metricsTopic = metricsTopic;
        this.logsTopic = logsTopic;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public String getName() {
        return "kafka";
    }

    @Override
    public void exportTrace(TraceRecord trace) {
        send(tracesTopic, trace.getTraceId(), trace);
    }

    @Override
    public void exportMetrics(List<MetricRecord> metrics) {
        for (MetricRecord metric : metrics) {
            send(metricsTopic, metric.getName(), metric);
        }
    }

    @Override
    public void exportLog(LogRecord record) {
        send(logsTopic, record.getTraceId(), record);
    }

    private void send(String topic, String key, Object value) {
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, value);
            SendResult<String, Object> result = future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Sent telemetry to {} key={} partition={}", topic, key,
                    result != null ? result.getRecordMetadata().partition() : null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmissionException("Interrupted while sending telemetry to " + topic, e);
        } catch (ExecutionException e) {
            throw new EmissionException("Kafka rejected telemetry for " + topic + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new EmissionException("No acknowledgement from " + topic + " within " + sendTimeoutMs + "ms", e);
        } catch (KafkaException e) {
            throw new EmissionException("Kafka send to " + topic + " failed: " + e.getMessage(), e);
        }
    }
}
