package com.payment.fraudcheck.emission;

import lombok.Value;

@Value
public class EmissionStats {
    String collector;
    long enqueued;
    long exported;
    /** Evicted from a full queue before export. */
    long dropped;
    /** Rejected by the collector. */
    long failed;
    int queued;
}
