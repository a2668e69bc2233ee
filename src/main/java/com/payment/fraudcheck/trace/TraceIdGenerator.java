package com.payment.fraudcheck.trace;

import java.util.Random;
import java.util.regex.Pattern;

/**
 * Random trace ids (128-bit, 32 lower-case hex chars) and span ids (64-bit, 16 hex chars).
 * Neither may be all zeros.
 */
public class TraceIdGenerator {

    private static final Pattern TRACE_ID = Pattern.compile("[0-9a-f]{32}");
    private static final Pattern SPAN_ID = Pattern.compile("[0-9a-f]{16}");

    private final Random random;

    public TraceIdGenerator(Random random) {
        this.random = random;
    }

    public String newTraceId() {
        long high;
        long low;
        do {
            high = random.nextLong();
            low = random.nextLong();
        } while (high == 0L && low == 0L);
        return hex(high) + hex(low);
    }

    public String newSpanId() {
        long id;
        do {
            id = random.nextLong();
        } while (id == 0L);
        return hex(id);
    }

    public static boolean isValidTraceId(String traceId) {
        return traceId != null && TRACE_ID.matcher(traceId).matches() && !traceId.chars().allMatch(c -> c == '0');
    }

    public static boolean isValidSpanId(String spanId) {
        return spanId != null && SPAN_ID.matcher(spanId).matches() && !spanId.chars().allMatch(c -> c == '0');
    }

    private static String hex(long value) {
        String s = Long.toHexString(value);
        return "0".repeat(16 - s.length()) + s;
    }
}
