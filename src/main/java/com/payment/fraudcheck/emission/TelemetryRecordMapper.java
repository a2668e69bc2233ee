package com.payment.fraudcheck.emission;

import com.payment.fraudcheck.metrics.MetricSeriesSnapshot;
import com.payment.fraudcheck.metrics.MetricsSnapshot;
import com.payment.fraudcheck.trace.Span;
import com.payment.fraudcheck.trace.Trace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts internal traces and metric snapshots into collector wire records.
 */
@Component
public class TelemetryRecordMapper {

    public TraceRecord toRecord(Trace trace) {
        List<SpanRecord> spans = new ArrayList<>(trace.getSpans().size());
        for (Span span : trace.getSpans()) {
            spans.add(toRecord(span));
        }
        return TraceRecord.builder()
                .traceId(trace.getTraceId())
                .aborted(trace.isAborted())
                .spans(spans)
                .build();
    }

    SpanRecord toRecord(Span span) {
        if (!span.isEnded()) {
            // Sealed traces only contain ended spans; anything else is a recorder bug.
            throw new IllegalStateException("Span " + span.getName() + " of trace " + span.getTraceId() + " has no end time");
        }
        return SpanRecord.builder()
                .spanId(span.getSpanId())
                .parentSpanId(span.getParentSpanId())
                .traceId(span.getTraceId())
                .name(span.getName())
                .startTime(span.getStartTimeMs())
                .endTime(span.getEndTimeMs())
                .durationMs(span.getDurationMs())
                .attributes(new LinkedHashMap<>(span.getAttributes()))
                .status(span.getStatus().wireName())
                .statusMessage(span.getStatusMessage())
                .build();
    }

    /**
     * One record per statistic: {@code <name>.count}, {@code .sum}, {@code .max}, a {@code .bucket}
     * record per histogram bucket (tag {@code le}), and {@code fraud.outcomes} per status.
     */
    public List<MetricRecord> toRecords(MetricsSnapshot snapshot) {
        long timestamp = snapshot.getTakenAt().toEpochMilli();
        List<MetricRecord> records = new ArrayList<>();
        for (MetricSeriesSnapshot series : snapshot.getSeries()) {
            records.add(metric(series.getName() + ".count", series.getCount(), series.getTags(), timestamp));
            records.add(metric(series.getName() + ".sum", series.getSum(), series.getTags(), timestamp));
            records.add(metric(series.getName() + ".max", series.getMax(), series.getTags(), timestamp));
            List<Long> counts = series.getBucketCounts();
            for (int i = 0; i < counts.size(); i++) {
                Map<String, String> tags = new LinkedHashMap<>(series.getTags());
                tags.put("le", i < series.getBucketBounds().size() ? formatBound(series.getBucketBounds().get(i)) : "+Inf");
                records.add(metric(series.getName() + ".bucket", counts.get(i), tags, timestamp));
            }
        }
        snapshot.getOutcomes().forEach((status, count) ->
                records.add(metric("fraud.outcomes", count, Map.of("status", status), timestamp)));
        return records;
    }

    private static MetricRecord metric(String name, double value, Map<String, String> tags, long timestamp) {
        return MetricRecord.builder().name(name).value(value).tags(tags).timestamp(timestamp).build();
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
}
