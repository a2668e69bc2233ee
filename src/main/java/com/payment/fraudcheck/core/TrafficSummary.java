package com.payment.fraudcheck.core;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome counts of one demo traffic run.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TrafficSummary {
    int generated;
    int approved;
    int flagged;
    int errors;
    long elapsedMs;
    Instant timestamp;
}
