package com.payment.fraudcheck.core;

/**
 * The request that owned a fraud check was aborted (caller gave up, deadline passed) before it finished.
 */
public class RequestAbortedException extends RuntimeException {

    public RequestAbortedException(String message) {
        super(message);
    }
}
