package com.payment.fraudcheck.api;

/**
 * No score could be obtained: the decision-intelligence call kept failing or its circuit is open.
 * Callers get a 503 rather than a default score.
 */
public class FraudCheckUnavailableException extends RuntimeException {

    public FraudCheckUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
