package com.payment.fraudcheck.core;

import com.payment.fraudcheck.domain.FraudStatus;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.risk.engine.InvalidInputException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fires batches of random fraud checks so dashboards have something to show. Amounts are uniform between
 * $10 and $5000; each check gets its own trace.
 */
@Slf4j
@Component
public class DemoTrafficGenerator {

    public static final int MAX_REQUESTS = 100;
    static final double MIN_AMOUNT = 10.0;
    static final double MAX_AMOUNT = 5000.0;
    private static final String[] MERCHANTS = {"merchant_coffee", "merchant_grocery", "merchant_gas",
            "merchant_pharmacy", "merchant_electronics"};

    private final FraudCheckService fraudCheckService;
    private final Clock clock;
    private final ExecutorService executor;

    public DemoTrafficGenerator(FraudCheckService fraudCheckService,
                                Clock clock,
                                @Value("${fraudcheck.demo.concurrency:10}") int concurrency) {
        this.fraudCheckService = fraudCheckService;
        this.clock = clock;
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, concurrency), r -> {
            Thread t = new Thread(r, "demo-traffic-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code requests} checks concurrently and waits for all of them.
     *
     * @throws InvalidInputException when {@code requests} is outside 1..100
     */
    public TrafficSummary generate(int requests) {
        if (requests < 1 || requests > MAX_REQUESTS) {
            throw new InvalidInputException("requests must be between 1 and " + MAX_REQUESTS + ", got " + requests);
        }
        log.info("Generating {} demo fraud checks", requests);
        long start = clock.millis();
        List<Future<FraudStatus>> futures = new ArrayList<>(requests);
        for (int i = 0; i < requests; i++) {
            Transaction transaction = randomTransaction();
            futures.add(executor.submit(() -> fraudCheckService.checkFraud(transaction).getStatus()));
        }

        int approved = 0;
        int flagged = 0;
        int errors = 0;
        for (Future<FraudStatus> future : futures) {
            try {
                if (future.get() == FraudStatus.FLAGGED) {
                    flagged++;
                } else {
                    approved++;
                }
            } catch (ExecutionException e) {
                errors++;
                log.warn("Demo fraud check failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new RequestAbortedException("Demo traffic generation interrupted");
            }
        }
        TrafficSummary summary = TrafficSummary.builder()
                .generated(requests)
                .approved(approved)
                .flagged(flagged)
                .errors(errors)
                .elapsedMs(clock.millis() - start)
                .timestamp(Instant.now(clock))
                .build();
        log.info("Generated {} demo fraud checks: approved={} flagged={} errors={} elapsedMs={}",
                requests, approved, flagged, errors, summary.getElapsedMs());
        return summary;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private static Transaction randomTransaction() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        BigDecimal amount = BigDecimal.valueOf(random.nextDouble(MIN_AMOUNT, MAX_AMOUNT))
                .setScale(2, RoundingMode.HALF_UP);
        return Transaction.builder()
                .transactionId("txn_" + random.nextInt(1000, 10000))
                .amount(amount)
                .merchantId(MERCHANTS[random.nextInt(MERCHANTS.length)])
                .timestamp(Instant.now())
                .build();
    }
}
