package com.payment.fraudcheck.trace;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpanStatus {
    OK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
