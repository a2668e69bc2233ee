package com.payment.fraudcheck.risk.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Risk model settings under {@code fraudcheck.risk}. Amount bands give the base score,
 * risk factor weights bound the perturbation added on top of it.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "fraudcheck.risk")
public class RiskModelProperties {

    public enum SeedMode { RANDOM, TRANSACTION }

    /** Scores strictly above this are flagged. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double riskThreshold = 70.0;

    /** Ascending amount cutoffs; an amount above the n-th cutoff falls into band n+1. */
    @NotNull
    private List<BigDecimal> bandBoundaries = new ArrayList<>(List.of(
            new BigDecimal("50"), new BigDecimal("1000"), new BigDecimal("5000")));

    /** Base score per band, one more entry than {@link #bandBoundaries}. */
    @NotEmpty
    private List<Double> bandScores = new ArrayList<>(List.of(10.0, 30.0, 55.0, 75.0));

    /**
     * Factor name to maximum contribution. Iteration order is the order factors are reported in.
     * Left empty here because the binder merges configured entries into an existing map; see {@link #validate()}.
     */
    @NotNull
    private Map<String, Double> riskFactorWeights = new LinkedHashMap<>();

    private SeedMode seedMode = SeedMode.RANDOM;

    static Map<String, Double> defaultRiskFactorWeights() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("merchant_category", 10.0);
        defaults.put("velocity", 15.0);
        defaults.put("location", 10.0);
        return defaults;
    }

    /**
     * Checks the cross-field rules bean validation cannot express. Bands must be monotonic so a
     * larger amount never lowers the base score. Falls back to the default factors when none are configured.
     */
    @PostConstruct
    public void validate() {
        if (riskFactorWeights.isEmpty()) {
            riskFactorWeights.putAll(defaultRiskFactorWeights());
        }
        for (int i = 0; i < bandBoundaries.size(); i++) {
            BigDecimal cutoff = bandBoundaries.get(i);
            if (cutoff == null || cutoff.signum() <= 0) {
                throw new IllegalStateException("fraudcheck.risk.band-boundaries must be positive, got " + bandBoundaries);
            }
            if (i > 0 && cutoff.compareTo(bandBoundaries.get(i - 1)) <= 0) {
                throw new IllegalStateException("fraudcheck.risk.band-boundaries must be strictly ascending, got " + bandBoundaries);
            }
        }
        if (bandScores.size() != bandBoundaries.size() + 1) {
            throw new IllegalStateException("fraudcheck.risk.band-scores needs " + (bandBoundaries.size() + 1)
                    + " entries for " + bandBoundaries.size() + " boundaries, got " + bandScores.size());
        }
        for (int i = 0; i < bandScores.size(); i++) {
            Double score = bandScores.get(i);
            if (score == null || score < 0 || score > 100) {
                throw new IllegalStateException("fraudcheck.risk.band-scores must be within [0, 100], got " + bandScores);
            }
            if (i > 0 && score < bandScores.get(i - 1)) {
                throw new IllegalStateException("fraudcheck.risk.band-scores must be non-decreasing, got " + bandScores);
            }
        }
        riskFactorWeights.forEach((name, weight) -> {
            if (weight == null || weight < 0) {
                throw new IllegalStateException("fraudcheck.risk.risk-factor-weights." + name + " must be >= 0");
            }
        });
    }
}
