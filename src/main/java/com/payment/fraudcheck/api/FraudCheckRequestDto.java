package com.payment.fraudcheck.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * REST API request body for a fraud check.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FraudCheckRequestDto {

    @NotBlank(message = "transaction_id is required")
    private String transactionId;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "amount must be greater than 0")
    private BigDecimal amount;

    private String merchantId;

    @Pattern(regexp = "[A-Z]{3}", message = "currency must be a three-letter ISO 4217 code")
    private String currency = "USD";

    /** Defaults to the time the request is received. */
    private Instant timestamp;

    /** Observed intensities in [0, 1] per risk factor; unset factors are sampled. */
    private Map<String, Double> riskSignals;
}
