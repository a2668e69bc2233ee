package com.payment.fraudcheck.emission;

import com.payment.fraudcheck.FraudCheckApplication;
import com.payment.fraudcheck.core.FraudCheckService;
import com.payment.fraudcheck.domain.Transaction;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test against an in-JVM broker: traces reach the telemetry-traces topic as snake_case JSON.
 */
@SpringBootTest(classes = FraudCheckApplication.class, properties = "fraudcheck.telemetry.collector=kafka")
@ActiveProfiles("test")
@EmbeddedKafka(partitions = 1, topics = {"telemetry-traces", "telemetry-metrics", "telemetry-logs"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
class KafkaTelemetryCollectorIntegrationTest {

    @Autowired
    private FraudCheckService fraudCheckService;

    @Autowired
    private EmissionSinkAdapter sink;

    @Autowired
    private EmbeddedKafkaBroker broker;

    @Test
    void traceIsPublishedKeyedByTraceId() throws Exception {
        assertThat(sink.stats().getCollector()).isEqualTo("kafka");
        Map<String, Object> props = KafkaTestUtils.consumerProps("telemetry-it", "true", broker);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        try (Consumer<String, String> consumer = new DefaultKafkaConsumerFactory<>(props,
                new StringDeserializer(), new StringDeserializer()).createConsumer()) {
            broker.consumeFromAnEmbeddedTopic(consumer, "telemetry-traces");

            fraudCheckService.checkFraud(Transaction.builder()
                    .transactionId("txn_kafka_1")
                    .amount(new BigDecimal("120.00"))
                    .merchantId("merchant_gas")
                    .timestamp(Instant.now())
                    .build());
            assertThat(sink.awaitIdle(Duration.ofSeconds(10))).isTrue();

            ConsumerRecord<String, String> record = KafkaTestUtils.getSingleRecord(consumer, "telemetry-traces", Duration.ofSeconds(10));
            assertThat(record.value()).contains("\"trace_id\":\"" + record.key() + "\"");
            assertThat(record.value()).contains("\"span_id\"", "\"parent_span_id\"", "\"fraud.check\"");
        }
    }
}
