package com.payment.fraudcheck.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transaction submitted for a fraud check. Created by the caller and never mutated afterwards.
 */
@Value
public class Transaction {

    String transactionId;

    /** Must be strictly positive. */
    BigDecimal amount;

    String merchantId;

    Instant timestamp;

    /** ISO 4217 code, USD when the caller does not say otherwise. */
    String currencyCode;

    /**
     * Optional observed intensities (0.0 to 1.0) per risk factor name, e.g. {@code velocity -> 0.9}.
     * Factors missing here are simulated by the risk model.
     */
    Map<String, Double> riskSignals;

    @Builder
    private Transaction(String transactionId, BigDecimal amount, String merchantId, Instant timestamp,
                        String currencyCode, Map<String, Double> riskSignals) {
        this.transactionId = transactionId;
        this.amount = amount;
        this.merchantId = merchantId;
        this.timestamp = timestamp;
        this.currencyCode = currencyCode != null ? currencyCode : "USD";
        // own copy of the caller's map; null intensities are allowed
        this.riskSignals = riskSignals != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(riskSignals))
                : Map.of();
    }
}
