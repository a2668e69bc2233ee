package com.payment.fraudcheck.trace;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed span attributes. Values are limited to String, Long, Double and Boolean so every collector can
 * represent them; insertion order is kept.
 */
public final class SpanAttributes {

    private static final SpanAttributes EMPTY = new SpanAttributes(Map.of());

    private final Map<String, Object> values;

    private SpanAttributes(Map<String, Object> values) {
        this.values = values;
    }

    public static SpanAttributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, String value) {
            if (value != null) {
                values.put(key, value);
            }
            return this;
        }

        public Builder put(String key, long value) {
            values.put(key, value);
            return this;
        }

        public Builder put(String key, double value) {
            values.put(key, value);
            return this;
        }

        public Builder put(String key, boolean value) {
            values.put(key, value);
            return this;
        }

        /** Amounts are reported as doubles; collectors have no decimal type. */
        public Builder put(String key, BigDecimal value) {
            if (value != null) {
                values.put(key, value.doubleValue());
            }
            return this;
        }

        public SpanAttributes build() {
            return new SpanAttributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
