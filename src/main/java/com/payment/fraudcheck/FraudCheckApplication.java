package com.payment.fraudcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the fraud check tracing service. Enables:
 * <ul>
 *   <li>Risk scoring through a simulated decision-intelligence client (Resilience4j circuit breaker and retry)</li>
 *   <li>One four-span trace per fraud check, continued from an inbound {@code traceparent} when present</li>
 *   <li>Telemetry export to the log or to Kafka topics, plus a periodic metrics snapshot</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class FraudCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudCheckApplication.class, args);
    }
}
