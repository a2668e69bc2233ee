package com.payment.fraudcheck.emission;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for KafkaTelemetryCollector (topic routing, keys, broker failures).
 */
@ExtendWith(MockitoExtension.class)
class KafkaTelemetryCollectorTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaTelemetryCollector collector;

    @BeforeEach
    void setUp() {
        collector = new KafkaTelemetryCollector(kafkaTemplate, "traces", "metrics", "logs", 1000);
    }

    @Test
    void traceIsKeyedByTraceId() {
        TraceRecord trace = TraceRecord.builder().traceId(TRACE_ID).aborted(false).spans(List.of()).build();
        when(kafkaTemplate.send("traces", TRACE_ID, trace)).thenReturn(acked("traces", TRACE_ID, trace));

        collector.exportTrace(trace);

        verify(kafkaTemplate).send("traces", TRACE_ID, trace);
    }

    @Test
    void logIsKeyedByTraceIdAndMetricsByName() {
        LogRecord record = LogRecord.builder()
                .timestamp(1L)
                .severity("WARN")
                .body("Suspicious transaction detected: txn_1")
                .traceId(TRACE_ID)
                .spanId("00f067aa0ba902b7")
                .attributes(Map.of())
                .build();
        MetricRecord checks = MetricRecord.builder().name("fraud.checks.count").value(3).tags(Map.of()).timestamp(1L).build();
        MetricRecord outcomes = MetricRecord.builder().name("fraud.outcomes").value(2).tags(Map.of("status", "flagged")).timestamp(1L).build();
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenAnswer(inv -> acked(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));

        collector.exportLog(record);
        collector.exportMetrics(List.of(checks, outcomes));

        verify(kafkaTemplate).send("logs", TRACE_ID, record);
        verify(kafkaTemplate).send("metrics", "fraud.checks.count", checks);
        verify(kafkaTemplate).send("metrics", "fraud.outcomes", outcomes);
    }

    @Test
    void brokerRejectionBecomesEmissionException() {
        TraceRecord trace = TraceRecord.builder().traceId(TRACE_ID).aborted(true).spans(List.of()).build();
        when(kafkaTemplate.send(eq("traces"), eq(TRACE_ID), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatThrownBy(() -> collector.exportTrace(trace))
                .isInstanceOf(EmissionException.class)
                .hasMessageContaining("traces")
                .hasMessageContaining("broker down");
    }

    @Test
    void synchronousSendFailureBecomesEmissionException() {
        TraceRecord trace = TraceRecord.builder().traceId(TRACE_ID).aborted(false).spans(List.of()).build();
        when(kafkaTemplate.send(eq("traces"), eq(TRACE_ID), any())).thenThrow(new KafkaException("no metadata"));

        assertThatThrownBy(() -> collector.exportTrace(trace))
                .isInstanceOf(EmissionException.class)
                .hasCauseInstanceOf(KafkaException.class);
    }

    @Test
    void unacknowledgedSendTimesOut() {
        KafkaTelemetryCollector impatient = new KafkaTelemetryCollector(kafkaTemplate, "traces", "metrics", "logs", 10);
        TraceRecord trace = TraceRecord.builder().traceId(TRACE_ID).aborted(false).spans(List.of()).build();
        when(kafkaTemplate.send(eq("traces"), eq(TRACE_ID), any())).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> impatient.exportTrace(trace))
                .isInstanceOf(EmissionException.class)
                .hasMessageContaining("No acknowledgement");
        assertThat(impatient.getName()).isEqualTo("kafka");
    }

    private static CompletableFuture<SendResult<String, Object>> acked(String topic, String key, Object value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<String, Object>(new ProducerRecord<String, Object>(topic, key, value), metadata));
    }
}
