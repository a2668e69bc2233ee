package com.payment.fraudcheck.emission;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Collector wire shape of one span. Times are epoch milliseconds.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpanRecord {
    String spanId;
    String parentSpanId;
    String traceId;
    String name;
    long startTime;
    long endTime;
    long durationMs;
    Map<String, Object> attributes;
    String status;
    String statusMessage;
}
