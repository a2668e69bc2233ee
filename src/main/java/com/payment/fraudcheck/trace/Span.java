package com.payment.fraudcheck.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A timed unit of work inside one trace. Created and ended only through the {@link TraceRecorder} that
 * owns it; read-only to everyone else.
 */
public final class Span {

    private final TraceRecorder owner;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final Span parent;
    private final String name;
    private final long startTimeMs;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private Long endTimeMs;
    private SpanStatus status;
    private String statusMessage;
    private int openChildren;

    Span(TraceRecorder owner, String traceId, String spanId, String parentSpanId, Span parent,
         String name, long startTimeMs) {
        this.owner = owner;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.parent = parent;
        this.name = name;
        this.startTimeMs = startTimeMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    /** Parent span id; for the root this is the attached remote parent, or null. */
    public String getParentSpanId() {
        return parentSpanId;
    }

    public String getName() {
        return name;
    }

    public long getStartTimeMs() {
        return startTimeMs;
    }

    /** Null while the span is open. */
    public Long getEndTimeMs() {
        return endTimeMs;
    }

    public long getDurationMs() {
        return endTimeMs != null ? endTimeMs - startTimeMs : 0L;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public SpanStatus getStatus() {
        return status;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public boolean isEnded() {
        return endTimeMs != null;
    }

    /** Context for spans started under this one. */
    public TraceContext context() {
        return new TraceContext(traceId, spanId, false);
    }

    TraceRecorder owner() {
        return owner;
    }

    Span parent() {
        return parent;
    }

    int openChildren() {
        return openChildren;
    }

    void childOpened() {
        openChildren++;
    }

    void childEnded() {
        openChildren--;
    }

    void end(long endTimeMs, SpanAttributes extra, SpanStatus status, String statusMessage) {
        this.attributes.putAll(extra.asMap());
        this.endTimeMs = Math.max(endTimeMs, startTimeMs);
        this.status = status;
        this.statusMessage = statusMessage;
    }

    @Override
    public String toString() {
        return "Span{" + name + ", traceId=" + traceId + ", spanId=" + spanId + ", parent=" + parentSpanId
                + ", ended=" + isEnded() + ", status=" + status + "}";
    }
}
