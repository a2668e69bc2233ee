package com.payment.fraudcheck.metrics;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate of one metric series (name plus tag set) at the moment of a snapshot.
 */
@Value
@Builder
public class MetricSeriesSnapshot {

    String name;
    Map<String, String> tags;
    long count;
    double sum;
    double min;
    double max;
    /** Upper bounds (inclusive) of the histogram buckets. */
    List<Double> bucketBounds;
    /** Samples per bucket; one more entry than {@link #bucketBounds} for values above the last bound. */
    List<Long> bucketCounts;

    public double getMean() {
        return count == 0 ? 0.0 : sum / count;
    }
}
