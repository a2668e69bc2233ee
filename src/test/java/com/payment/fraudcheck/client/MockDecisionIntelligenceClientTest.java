package com.payment.fraudcheck.client;

import com.payment.fraudcheck.core.RequestAbortedException;
import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.risk.config.RiskModelProperties;
import com.payment.fraudcheck.risk.engine.RiskModel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockDecisionIntelligenceClientTest {

    private final RiskModel riskModel = new RiskModel(new RiskModelProperties());
    private final Transaction transaction = Transaction.builder()
            .transactionId("txn_mock")
            .amount(new BigDecimal("320.00"))
            .merchantId("merchant-1")
            .timestamp(Instant.now())
            .build();

    @Test
    void scoresWithTheGivenSeed() {
        MockDecisionIntelligenceClient client = new MockDecisionIntelligenceClient(riskModel, 0, 0, 0.0);

        RiskAssessment assessment = client.checkFraud(transaction, 17L);

        assertThat(assessment).isEqualTo(riskModel.assess(transaction, new Random(17L)));
        assertThat(client.getApiName()).isEqualTo("decision_intelligence");
    }

    @Test
    void simulatesLatency() {
        MockDecisionIntelligenceClient client = new MockDecisionIntelligenceClient(riskModel, 30, 40, 0.0);

        long start = System.nanoTime();
        client.checkFraud(transaction, 1L);

        assertThat((System.nanoTime() - start) / 1_000_000).isGreaterThanOrEqualTo(30);
    }

    @Test
    void failureRateOfOneAlwaysFails() {
        MockDecisionIntelligenceClient client = new MockDecisionIntelligenceClient(riskModel, 0, 0, 1.0);

        assertThatThrownBy(() -> client.checkFraud(transaction, 1L)).isInstanceOf(DecisionIntelligenceException.class);
    }

    @Test
    void interruptionDuringLatencyAbortsTheRequest() throws Exception {
        MockDecisionIntelligenceClient client = new MockDecisionIntelligenceClient(riskModel, 5_000, 5_000, 0.0);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                client.checkFraud(transaction, 1L);
            } catch (RuntimeException e) {
                thrown.set(e);
            }
        });

        caller.start();
        Thread.sleep(50);
        caller.interrupt();
        caller.join(2_000);

        assertThat(thrown.get()).isInstanceOf(RequestAbortedException.class);
    }
}
