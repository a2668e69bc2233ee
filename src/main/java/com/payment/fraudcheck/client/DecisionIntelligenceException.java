package com.payment.fraudcheck.client;

/**
 * The decision-intelligence service did not return a usable answer. Retried by the caller.
 */
public class DecisionIntelligenceException extends RuntimeException {

    public DecisionIntelligenceException(String message) {
        super(message);
    }
}
