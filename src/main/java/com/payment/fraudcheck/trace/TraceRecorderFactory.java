package com.payment.fraudcheck.trace;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.function.Consumer;

/**
 * Hands out one {@link TraceRecorder} per request, sharing the id generator and clock.
 */
@RequiredArgsConstructor
public class TraceRecorderFactory {

    private final TraceIdGenerator ids;
    private final Clock clock;

    public TraceRecorder open(TraceContext context, Consumer<Trace> onSealed) {
        return new TraceRecorder(context, ids, clock, onSealed);
    }
}
