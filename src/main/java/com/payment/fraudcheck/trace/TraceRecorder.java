package com.payment.fraudcheck.trace;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds the span tree of a single request. Spans nest strictly: a span can only end after all of its
 * children have ended. Ending the root seals the trace and hands it to the sealed-trace consumer exactly
 * once. One recorder per request; methods are synchronized so an abort may come from another thread.
 */
@Slf4j
public class TraceRecorder {

    public static final String ABORTED = "aborted";
    public static final String ERROR_REASON = "error.reason";

    private final TraceContext context;
    private final TraceIdGenerator ids;
    private final Clock clock;
    private final Consumer<Trace> onSealed;
    private final List<Span> spans = new ArrayList<>();

    private Span root;
    private boolean sealed;

    /**
     * @param context  trace id of this request plus, when attached to an inbound caller span, its span id
     * @param onSealed receives the completed trace; must not block
     */
    public TraceRecorder(TraceContext context, TraceIdGenerator ids, Clock clock, Consumer<Trace> onSealed) {
        this.context = context;
        this.ids = ids;
        this.clock = clock;
        this.onSealed = onSealed;
    }

    public String getTraceId() {
        return context.getTraceId();
    }

    /**
     * Opens a span. {@code parent == null} opens the root, which must be the first span of the trace.
     */
    public synchronized Span beginSpan(String name, Span parent) {
        if (sealed) {
            throw new SpanLifecycleException("Cannot begin span '" + name + "': trace " + getTraceId() + " is sealed");
        }
        long now = clock.millis();
        Span span;
        if (parent == null) {
            if (root != null) {
                throw new SpanLifecycleException("Trace " + getTraceId() + " already has root span '" + root.getName() + "'");
            }
            span = new Span(this, getTraceId(), ids.newSpanId(), context.getSpanId(), null, name, now);
            root = span;
        } else {
            requireOwned(parent, "parent");
            if (parent.isEnded()) {
                throw new SpanLifecycleException("Cannot begin span '" + name + "' under ended span '" + parent.getName() + "'");
            }
            span = new Span(this, getTraceId(), ids.newSpanId(), parent.getSpanId(), parent, name,
                    Math.max(now, parent.getStartTimeMs()));
            parent.childOpened();
        }
        spans.add(span);
        return span;
    }

    public void endSpan(Span span, SpanAttributes attributes, SpanStatus status) {
        endSpan(span, attributes, status, null);
    }

    public synchronized void endSpan(Span span, SpanAttributes attributes, SpanStatus status, String statusMessage) {
        requireOwned(span, "span");
        if (sealed) {
            throw new SpanLifecycleException("Cannot end span '" + span.getName() + "': trace " + getTraceId() + " is sealed");
        }
        if (span.isEnded()) {
            throw new SpanLifecycleException("Span '" + span.getName() + "' already ended");
        }
        if (span.openChildren() > 0) {
            throw new SpanLifecycleException("Span '" + span.getName() + "' still has " + span.openChildren() + " open child span(s)");
        }
        close(span, attributes != null ? attributes : SpanAttributes.empty(), status, statusMessage);
        if (span == root) {
            seal(false);
        }
    }

    /**
     * Ends every open span with status error, innermost first, then seals the trace. No-op once sealed.
     */
    public synchronized void abort(String reason) {
        if (sealed) {
            return;
        }
        SpanAttributes attributes = SpanAttributes.builder().put(ERROR_REASON, reason).build();
        int closed = 0;
        for (int i = spans.size() - 1; i >= 0; i--) {
            Span span = spans.get(i);
            if (!span.isEnded()) {
                close(span, attributes, SpanStatus.ERROR, reason);
                closed++;
            }
        }
        log.debug("Trace {} aborted ({}): closed {} open span(s)", getTraceId(), reason, closed);
        seal(true);
    }

    /** Drops the trace without handing it on. Used after a lifecycle violation. */
    public synchronized void discard() {
        sealed = true;
        spans.clear();
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized int openSpanCount() {
        return (int) spans.stream().filter(s -> !s.isEnded()).count();
    }

    private void close(Span span, SpanAttributes attributes, SpanStatus status, String statusMessage) {
        span.end(clock.millis(), attributes, status, statusMessage);
        if (span.parent() != null) {
            span.parent().childEnded();
        }
    }

    private void seal(boolean aborted) {
        sealed = true;
        if (spans.isEmpty()) {
            return;
        }
        Trace trace = new Trace(getTraceId(), spans, aborted);
        try {
            onSealed.accept(trace);
        } catch (RuntimeException e) {
            log.warn("Sealed-trace consumer failed for trace {}: {}", getTraceId(), e.getMessage(), e);
        }
    }

    private void requireOwned(Span span, String role) {
        if (span == null) {
            throw new SpanLifecycleException(role + " must not be null");
        }
        if (span.owner() != this) {
            throw new SpanLifecycleException("Span '" + span.getName() + "' belongs to trace " + span.getTraceId()
                    + ", not " + getTraceId());
        }
    }
}
