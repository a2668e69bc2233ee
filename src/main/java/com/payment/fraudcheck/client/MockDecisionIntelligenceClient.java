package com.payment.fraudcheck.client;

import com.payment.fraudcheck.core.RequestAbortedException;
import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.risk.engine.RiskModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulated decision-intelligence client for demos and load tests: waits a random latency, optionally
 * fails, then scores with the local {@link RiskModel}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraudcheck.client.mock.enabled", havingValue = "true", matchIfMissing = true)
public class MockDecisionIntelligenceClient implements DecisionIntelligenceClient {

    private final RiskModel riskModel;
    private final long latencyMinMs;
    private final long latencyMaxMs;
    private final double failureRate;

    public MockDecisionIntelligenceClient(RiskModel riskModel,
                                          @Value("${fraudcheck.client.mock.latency-min-ms:0}") long latencyMinMs,
                                          @Value("${fraudcheck.client.mock.latency-max-ms:0}") long latencyMaxMs,
                                          @Value("${fraudcheck.client.mock.failure-rate:0.0}") double failureRate) {
        this.riskModel = riskModel;
        this.latencyMinMs = Math.max(0, latencyMinMs);
        this.latencyMaxMs = Math.max(this.latencyMinMs, latencyMaxMs);
        this.failureRate = failureRate;
    }

    @Override
    public String getApiName() {
        return "decision_intelligence";
    }

    @Override
    public RiskAssessment checkFraud(Transaction transaction, long seed) {
        log.debug("Mock decision intelligence call: transactionId={} amount={}",
                transaction.getTransactionId(), transaction.getAmount());
        simulateLatency();
        // Latency and failures are simulation noise, independent of the scoring seed.
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw new DecisionIntelligenceException("Simulated decision intelligence failure");
        }
        return riskModel.assess(transaction, new Random(seed));
    }

    private void simulateLatency() {
        if (latencyMaxMs == 0) {
            return;
        }
        long latency = latencyMinMs == latencyMaxMs
                ? latencyMinMs
                : ThreadLocalRandom.current().nextLong(latencyMinMs, latencyMaxMs + 1);
        try {
            Thread.sleep(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestAbortedException("Interrupted during decision intelligence call");
        }
    }
}
