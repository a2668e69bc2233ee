package com.payment.fraudcheck.trace;

import java.util.List;
import java.util.Optional;

/**
 * All spans of one request, in creation order. Built by {@link TraceRecorder} once the root span has
 * ended (or the request was aborted); nothing in it changes afterwards.
 */
public final class Trace {

    private final String traceId;
    private final List<Span> spans;
    private final boolean aborted;

    Trace(String traceId, List<Span> spans, boolean aborted) {
        this.traceId = traceId;
        this.spans = List.copyOf(spans);
        this.aborted = aborted;
    }

    public String getTraceId() {
        return traceId;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public boolean isAborted() {
        return aborted;
    }

    public Span getRoot() {
        return spans.get(0);
    }

    public Optional<Span> findSpan(String name) {
        return spans.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public long getDurationMs() {
        return spans.isEmpty() ? 0L : getRoot().getDurationMs();
    }
}
