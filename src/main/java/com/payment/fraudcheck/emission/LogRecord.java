package com.payment.fraudcheck.emission;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Structured log record correlated with the span that produced it.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LogRecord {
    long timestamp;
    String severity;
    String body;
    String traceId;
    String spanId;
    Map<String, Object> attributes;
}
