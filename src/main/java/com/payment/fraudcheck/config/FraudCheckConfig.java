package com.payment.fraudcheck.config;

import com.payment.fraudcheck.risk.config.RiskModelProperties;
import com.payment.fraudcheck.risk.engine.RiskSeedSource;
import com.payment.fraudcheck.trace.TraceContextPropagator;
import com.payment.fraudcheck.trace.TraceIdGenerator;
import com.payment.fraudcheck.trace.TraceRecorderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wiring for the request path: id generation, clock, trace recorders and the risk seed source.
 */
@Slf4j
@Configuration
public class FraudCheckConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TraceIdGenerator traceIdGenerator() {
        return new TraceIdGenerator(new SecureRandom());
    }

    @Bean
    public TraceContextPropagator traceContextPropagator(TraceIdGenerator traceIdGenerator) {
        return new TraceContextPropagator(traceIdGenerator);
    }

    @Bean
    public TraceRecorderFactory traceRecorderFactory(TraceIdGenerator traceIdGenerator, Clock clock) {
        return new TraceRecorderFactory(traceIdGenerator, clock);
    }

    @Bean
    public RiskSeedSource riskSeedSource(RiskModelProperties properties) {
        log.info("Risk seed mode: {}", properties.getSeedMode());
        return properties.getSeedMode() == RiskModelProperties.SeedMode.TRANSACTION
                ? RiskSeedSource.perTransaction()
                : RiskSeedSource.random(new SecureRandom());
    }
}
