package com.payment.fraudcheck.emission;

/**
 * The telemetry collector could not accept a record. Never leaves {@link EmissionSinkAdapter}.
 */
public class EmissionException extends RuntimeException {

    public EmissionException(String message) {
        super(message);
    }

    public EmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
