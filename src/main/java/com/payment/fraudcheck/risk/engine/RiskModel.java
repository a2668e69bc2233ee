package com.payment.fraudcheck.risk.engine;

import com.payment.fraudcheck.domain.FraudStatus;
import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.RiskFactor;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.risk.config.RiskModelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Scores a transaction: base score from its amount band plus a weighted contribution per risk factor.
 * Has no state of its own; the same transaction and the same seeded {@link Random} always give the same result.
 */
@Slf4j
@Component
public class RiskModel {

    private static final String[] BAND_NAMES = {"low", "medium", "high", "very_high"};

    private final RiskModelProperties properties;

    public RiskModel(RiskModelProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    public RiskAssessment assess(Transaction transaction, Random random) {
        validate(transaction);

        List<RiskFactor> factors = new ArrayList<>();
        int band = bandOf(transaction.getAmount());
        double score = properties.getBandScores().get(band);
        factors.add(new RiskFactor("amount_band:" + bandName(band), score));

        Map<String, Double> signals = transaction.getRiskSignals() != null ? transaction.getRiskSignals() : Map.of();
        // Draw for every factor, observed or not, so one factor's signal never shifts the others' draws.
        for (Map.Entry<String, Double> weight : properties.getRiskFactorWeights().entrySet()) {
            double drawn = random.nextDouble();
            Double observed = signals.get(weight.getKey());
            double intensity = observed != null ? clamp(observed, 0.0, 1.0) : drawn;
            double contribution = round2(weight.getValue() * intensity);
            factors.add(new RiskFactor(weight.getKey(), contribution));
            score += contribution;
        }

        double riskScore = round2(clamp(score, 0.0, 100.0));
        double threshold = properties.getRiskThreshold();
        FraudStatus status = FraudStatus.forScore(riskScore, threshold);

        log.debug("Risk assessment: transactionId={}, amount={}, band={}, score={}, status={}",
                transaction.getTransactionId(), transaction.getAmount(), bandName(band), riskScore, status);

        return RiskAssessment.builder()
                .transactionId(transaction.getTransactionId())
                .riskScore(riskScore)
                .status(status)
                .riskFactors(List.copyOf(factors))
                .threshold(threshold)
                .build();
    }

    /**
     * Rejects transactions that cannot be scored. Exposed so callers can fail before doing any other work.
     */
    public void validate(Transaction transaction) {
        if (transaction == null) {
            throw new InvalidInputException("transaction is required");
        }
        if (transaction.getTransactionId() == null || transaction.getTransactionId().isBlank()) {
            throw new InvalidInputException("transactionId must not be empty");
        }
        if (transaction.getAmount() == null || transaction.getAmount().signum() <= 0) {
            throw new InvalidInputException("amount must be greater than 0, got " + transaction.getAmount());
        }
        if (!isKnownCurrency(transaction.getCurrencyCode())) {
            throw new InvalidInputException("currency must be an ISO 4217 code, got " + transaction.getCurrencyCode());
        }
    }

    private static boolean isKnownCurrency(String code) {
        if (code == null || !code.matches("[A-Z]{3}")) {
            return false;
        }
        try {
            Currency.getInstance(code);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Index of the band the amount falls in: the number of cutoffs strictly below it. */
    int bandOf(BigDecimal amount) {
        int band = 0;
        for (BigDecimal cutoff : properties.getBandBoundaries()) {
            if (amount.compareTo(cutoff) > 0) {
                band++;
            }
        }
        return band;
    }

    static String bandName(int band) {
        return band < BAND_NAMES.length ? BAND_NAMES[band] : "band_" + band;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
