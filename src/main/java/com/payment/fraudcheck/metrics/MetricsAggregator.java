package com.payment.fraudcheck.metrics;

import com.payment.fraudcheck.domain.FraudStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide counters and duration histograms for fraud checks.
 * <p>
 * Every update and every snapshot takes the same monitor, so a snapshot never sees half of an
 * update (count moved but sum not yet). State is lost on restart; nothing is persisted here.
 */
@Slf4j
@Component
public class MetricsAggregator {

    static final double[] DEFAULT_BOUNDS_MS = {5, 10, 25, 50, 100, 250, 500, 1000, 2500, 5000};

    private final double[] bucketBounds;
    private final Map<SeriesKey, Series> series = new LinkedHashMap<>();
    private final Map<FraudStatus, Long> outcomes = new EnumMap<>(FraudStatus.class);
    private Instant startTime = Instant.now();

    public MetricsAggregator() {
        this(DEFAULT_BOUNDS_MS);
    }

    @Autowired
    public MetricsAggregator(
            @Value("${fraudcheck.metrics.histogram-bounds-ms:5,10,25,50,100,250,500,1000,2500,5000}") double[] bucketBounds) {
        double[] sorted = bucketBounds.clone();
        Arrays.sort(sorted);
        this.bucketBounds = sorted;
    }

    public synchronized void record(MetricSample sample) {
        if (sample == null || sample.getName() == null) {
            log.warn("Ignoring metric sample without a name: {}", sample);
            return;
        }
        Map<String, String> tags = sample.getTags() != null ? sample.getTags() : Map.of();
        series.computeIfAbsent(new SeriesKey(sample.getName(), Map.copyOf(tags)), k -> new Series(bucketBounds.length))
                .add(sample.getValue(), bucketIndex(sample.getValue()));
    }

    public synchronized void recordOutcome(FraudStatus status) {
        outcomes.merge(status, 1L, Long::sum);
    }

    public synchronized MetricsSnapshot snapshot() {
        List<Double> bounds = Arrays.stream(bucketBounds).boxed().toList();
        List<MetricSeriesSnapshot> copies = new ArrayList<>(series.size());
        series.forEach((key, s) -> copies.add(MetricSeriesSnapshot.builder()
                .name(key.name())
                .tags(key.tags())
                .count(s.count)
                .sum(s.sum)
                .min(s.count == 0 ? 0.0 : s.min)
                .max(s.count == 0 ? 0.0 : s.max)
                .bucketBounds(bounds)
                .bucketCounts(Arrays.stream(s.buckets).boxed().toList())
                .build()));
        Map<String, Long> outcomeCopy = new LinkedHashMap<>();
        for (FraudStatus status : FraudStatus.values()) {
            outcomeCopy.put(status.wireName(), outcomes.getOrDefault(status, 0L));
        }
        return MetricsSnapshot.builder()
                .startTime(startTime)
                .takenAt(Instant.now())
                .series(List.copyOf(copies))
                .outcomes(Map.copyOf(outcomeCopy))
                .build();
    }

    /** Clears all state, e.g. between load-test runs. */
    public synchronized void reset() {
        series.clear();
        outcomes.clear();
        startTime = Instant.now();
        log.info("Metrics reset");
    }

    private int bucketIndex(double value) {
        for (int i = 0; i < bucketBounds.length; i++) {
            if (value <= bucketBounds[i]) {
                return i;
            }
        }
        return bucketBounds.length;
    }

    private record SeriesKey(String name, Map<String, String> tags) {}

    private static final class Series {
        private final long[] buckets;
        private long count;
        private double sum;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        Series(int boundCount) {
            this.buckets = new long[boundCount + 1];
        }

        void add(double value, int bucket) {
            count++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            buckets[bucket]++;
        }
    }
}
