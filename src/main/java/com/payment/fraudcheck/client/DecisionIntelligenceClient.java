package com.payment.fraudcheck.client;

import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.Transaction;

/**
 * Downstream fraud scoring call. The production implementation would call Mastercard Decision
 * Intelligence; the mock simulates it with the local risk model.
 */
public interface DecisionIntelligenceClient {

    /** Name reported in the {@code api.name} span attribute. */
    String getApiName();

    /**
     * @param seed randomness for this request; the same seed must give the same assessment so retries agree
     */
    RiskAssessment checkFraud(Transaction transaction, long seed);
}
