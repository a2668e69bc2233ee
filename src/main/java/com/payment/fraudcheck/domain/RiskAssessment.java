package com.payment.fraudcheck.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of scoring one transaction. Built once by the risk model and never mutated.
 */
@Value
@Builder
public class RiskAssessment {

    String transactionId;
    /** 0.0–100.0, rounded to two decimals. */
    double riskScore;
    FraudStatus status;
    /** Contributions in the order they were applied; the amount band always comes first. */
    List<RiskFactor> riskFactors;
    /** Threshold the status was derived from. */
    double threshold;

    public boolean isFlagged() {
        return status == FraudStatus.FLAGGED;
    }

    public String getRecommendation() {
        return status.recommendation();
    }
}
