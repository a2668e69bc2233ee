package com.payment.fraudcheck.domain;

import lombok.Value;

/**
 * One additive contribution to a risk score, e.g. {@code amount_band:high -> 55.0}.
 */
@Value
public class RiskFactor {
    String name;
    double contribution;
}
