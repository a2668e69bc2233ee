package com.payment.fraudcheck.trace;

import lombok.Value;

/**
 * Identifiers handed explicitly from one step of a request to the next: the shared trace id and the
 * span id new spans should hang under. {@code spanId} is null for a brand-new trace.
 */
@Value
public class TraceContext {

    String traceId;
    String spanId;
    /** True when the ids came from an inbound header rather than a span of this process. */
    boolean remote;

    public boolean hasParentSpan() {
        return spanId != null;
    }
}
