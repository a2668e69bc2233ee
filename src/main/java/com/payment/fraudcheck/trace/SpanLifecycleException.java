package com.payment.fraudcheck.trace;

/**
 * A span was opened or closed out of order (parent ended before a child, span ended twice, span from
 * another trace). Always a programming defect; the trace it happened in is discarded.
 */
public class SpanLifecycleException extends RuntimeException {

    public SpanLifecycleException(String message) {
        super(message);
    }
}
