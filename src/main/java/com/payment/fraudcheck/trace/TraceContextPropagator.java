package com.payment.fraudcheck.trace;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Creates and carries trace contexts. Nothing is stored in thread-locals: the context is a value the
 * caller passes along, so concurrent requests cannot see each other's ids.
 * <p>
 * Inbound and outbound propagation use the W3C {@code traceparent} header
 * ({@code 00-<trace-id>-<parent-id>-<flags>}).
 */
@Slf4j
@RequiredArgsConstructor
public class TraceContextPropagator {

    public static final String TRACEPARENT_HEADER = "traceparent";
    private static final String VERSION = "00";
    private static final String SAMPLED = "01";

    private final TraceIdGenerator ids;

    /** Context for a new request: fresh trace id, no parent. */
    public TraceContext newTrace() {
        return new TraceContext(ids.newTraceId(), null, false);
    }

    /**
     * Context continuing the caller's trace when a valid {@code traceparent} is given, otherwise a new one.
     */
    public TraceContext continueOrStart(String traceparent) {
        return extract(traceparent).orElseGet(this::newTrace);
    }

    public Optional<TraceContext> extract(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return Optional.empty();
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length < 4 || parts[0].length() != 2 || "ff".equals(parts[0])) {
            log.debug("Ignoring malformed traceparent header: {}", traceparent);
            return Optional.empty();
        }
        if (VERSION.equals(parts[0]) && parts.length != 4) {
            log.debug("Ignoring traceparent with unexpected field count: {}", traceparent);
            return Optional.empty();
        }
        String traceId = parts[1];
        String spanId = parts[2];
        if (!TraceIdGenerator.isValidTraceId(traceId) || !TraceIdGenerator.isValidSpanId(spanId)) {
            log.debug("Ignoring traceparent with invalid ids: {}", traceparent);
            return Optional.empty();
        }
        return Optional.of(new TraceContext(traceId, spanId, true));
    }

    public String inject(TraceContext context) {
        if (!context.hasParentSpan()) {
            throw new IllegalArgumentException("traceparent needs a span id; trace " + context.getTraceId() + " has none");
        }
        return VERSION + "-" + context.getTraceId() + "-" + context.getSpanId() + "-" + SAMPLED;
    }

    public String inject(Span span) {
        return inject(span.context());
    }
}
