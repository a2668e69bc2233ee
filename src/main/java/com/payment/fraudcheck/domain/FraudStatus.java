package com.payment.fraudcheck.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a fraud check. A transaction is flagged only when its score exceeds the configured threshold.
 */
public enum FraudStatus {
    APPROVED("approved", "approve"),
    FLAGGED("flagged", "review");

    private final String wireName;
    private final String recommendation;

    FraudStatus(String wireName, String recommendation) {
        this.wireName = wireName;
        this.recommendation = recommendation;
    }

    /** Lower-case value used in span attributes, metric tags and API responses. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String recommendation() {
        return recommendation;
    }

    public static FraudStatus forScore(double riskScore, double threshold) {
        return riskScore > threshold ? FLAGGED : APPROVED;
    }
}
