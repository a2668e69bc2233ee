package com.payment.fraudcheck.metrics;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One observation: a counter increment (value 1) or a duration in milliseconds.
 */
@Value
@Builder
public class MetricSample {

    String name;
    double value;
    @Builder.Default
    Map<String, String> tags = Map.of();
    long timestampMs;

    public static MetricSample increment(String name, Map<String, String> tags) {
        return MetricSample.builder().name(name).value(1.0).tags(tags).timestampMs(System.currentTimeMillis()).build();
    }

    public static MetricSample duration(String name, long durationMs, Map<String, String> tags) {
        return MetricSample.builder().name(name).value(durationMs).tags(tags).timestampMs(System.currentTimeMillis()).build();
    }
}
