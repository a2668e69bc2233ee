package com.payment.fraudcheck.core;

import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.Transaction;
import lombok.Value;

import java.time.Instant;

/**
 * Assessment plus the identifiers of the trace that recorded it.
 */
@Value
public class FraudCheckResult {
    Transaction transaction;
    RiskAssessment assessment;
    String traceId;
    String rootSpanId;
    Instant completedAt;
}
