package com.payment.fraudcheck.emission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.fraudcheck.domain.FraudStatus;
import com.payment.fraudcheck.metrics.MetricSample;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import com.payment.fraudcheck.trace.Span;
import com.payment.fraudcheck.trace.SpanAttributes;
import com.payment.fraudcheck.trace.SpanStatus;
import com.payment.fraudcheck.trace.Trace;
import com.payment.fraudcheck.trace.TraceContext;
import com.payment.fraudcheck.trace.TraceIdGenerator;
import com.payment.fraudcheck.trace.TraceRecorder;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryRecordMapperTest {

    private final TelemetryRecordMapper mapper = new TelemetryRecordMapper();
    private final ObjectMapper json = new ObjectMapper();

    @Test
    void traceRecordUsesSnakeCaseWireNames() throws Exception {
        TraceRecord record = mapper.toRecord(sampleTrace());

        JsonNode tree = json.readTree(json.writeValueAsString(record));

        assertThat(tree.get("trace_id").asText()).hasSize(32);
        assertThat(tree.get("aborted").asBoolean()).isFalse();
        JsonNode root = tree.get("spans").get(0);
        assertThat(root.has("span_id")).isTrue();
        assertThat(root.get("parent_span_id").isNull()).isTrue();
        assertThat(root.has("start_time")).isTrue();
        assertThat(root.has("end_time")).isTrue();
        assertThat(root.has("duration_ms")).isTrue();
        assertThat(root.get("status").asText()).isEqualTo("ok");
        JsonNode child = tree.get("spans").get(1);
        assertThat(child.get("parent_span_id").asText()).isEqualTo(root.get("span_id").asText());
        assertThat(child.get("attributes").get("fraud.status").asText()).isEqualTo("approved");
        assertThat(child.get("attributes").get("fraud.risk_score").asDouble()).isEqualTo(33.5);
    }

    @Test
    void snapshotExpandsIntoStatisticRecords() {
        MetricsAggregator aggregator = new MetricsAggregator(new double[]{10, 100});
        aggregator.record(MetricSample.duration("span.duration", 7, Map.of("operation", "fraud.check")));
        aggregator.record(MetricSample.duration("span.duration", 250, Map.of("operation", "fraud.check")));
        aggregator.recordOutcome(FraudStatus.FLAGGED);

        List<MetricRecord> records = mapper.toRecords(aggregator.snapshot());

        assertThat(records).extracting(MetricRecord::getName)
                .contains("span.duration.count", "span.duration.sum", "span.duration.max", "span.duration.bucket", "fraud.outcomes");
        assertThat(records).filteredOn(r -> r.getName().equals("span.duration.count"))
                .singleElement().satisfies(r -> {
                    assertThat(r.getValue()).isEqualTo(2.0);
                    assertThat(r.getTags()).containsEntry("operation", "fraud.check");
                });
        assertThat(records).filteredOn(r -> r.getName().equals("span.duration.bucket"))
                .extracting(r -> r.getTags().get("le"))
                .containsExactly("10", "100", "+Inf");
        assertThat(records).filteredOn(r -> r.getName().equals("fraud.outcomes") && "flagged".equals(r.getTags().get("status")))
                .singleElement().extracting(MetricRecord::getValue).isEqualTo(1.0);
    }

    @Test
    void logRecordUsesSnakeCaseWireNames() throws Exception {
        LogRecord record = LogRecord.builder()
                .timestamp(1_700_000_000_000L)
                .severity("WARN")
                .body("Suspicious transaction detected: txn_1")
                .traceId("4bf92f3577b34da6a3ce929d0e0e4736")
                .spanId("00f067aa0ba902b7")
                .attributes(Map.of("fraud.risk_score", 88.0))
                .build();

        JsonNode tree = json.readTree(json.writeValueAsString(record));

        assertThat(tree.get("trace_id").asText()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(tree.get("span_id").asText()).isEqualTo("00f067aa0ba902b7");
        assertThat(tree.get("severity").asText()).isEqualTo("WARN");
    }

    private static Trace sampleTrace() {
        AtomicReference<Trace> sealed = new AtomicReference<>();
        TraceIdGenerator ids = new TraceIdGenerator(new Random(8));
        TraceRecorder recorder = new TraceRecorder(new TraceContext(ids.newTraceId(), null, false), ids, Clock.systemUTC(), sealed::set);
        Span root = recorder.beginSpan("http.request", null);
        Span check = recorder.beginSpan("fraud.check", root);
        recorder.endSpan(check, SpanAttributes.builder()
                .put("fraud.status", "approved")
                .put("fraud.risk_score", 33.5)
                .build(), SpanStatus.OK);
        recorder.endSpan(root, SpanAttributes.empty(), SpanStatus.OK);
        return sealed.get();
    }
}
