package com.payment.fraudcheck.risk.engine;

/**
 * Transaction data cannot be scored (missing id, non-positive amount). Raised before any span is opened.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
