package com.payment.fraudcheck.metrics;

import com.payment.fraudcheck.domain.FraudStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time copy of the aggregator state. Safe to hand to other threads.
 */
@Value
@Builder
public class MetricsSnapshot {

    Instant startTime;
    Instant takenAt;
    List<MetricSeriesSnapshot> series;
    /** Keyed by {@link FraudStatus#wireName()}. */
    Map<String, Long> outcomes;

    public Optional<MetricSeriesSnapshot> find(String name, Map<String, String> tags) {
        return series.stream()
                .filter(s -> s.getName().equals(name) && s.getTags().equals(tags))
                .findFirst();
    }

    /** Sample count of a metric across all of its tag sets. */
    public long count(String name) {
        return series.stream().filter(s -> s.getName().equals(name)).mapToLong(MetricSeriesSnapshot::getCount).sum();
    }

    public long getApprovedCount() {
        return outcomes.getOrDefault(FraudStatus.APPROVED.wireName(), 0L);
    }

    public long getFlaggedCount() {
        return outcomes.getOrDefault(FraudStatus.FLAGGED.wireName(), 0L);
    }
}
