package com.payment.fraudcheck.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.fraudcheck.emission.KafkaTelemetryCollector;
import com.payment.fraudcheck.emission.LoggingTelemetryCollector;
import com.payment.fraudcheck.emission.TelemetryCollector;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Selects the telemetry collector. {@code fraudcheck.telemetry.collector=kafka} publishes JSON records to
 * the telemetry topics; anything else falls back to JSON lines on the {@code telemetry} logger.
 * <p>
 * The JSON mapper is kept private to the collectors so it does not replace the MVC one.
 */
@Slf4j
@Configuration
public class TelemetryCollectorConfig {

    static ObjectMapper telemetryObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Configuration
    @ConditionalOnProperty(name = "fraudcheck.telemetry.collector", havingValue = "kafka")
    static class KafkaCollectorConfig {

        @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
        private String bootstrapServers;

        @Bean
        public ProducerFactory<String, Object> telemetryProducerFactory() {
            Map<String, Object> props = new HashMap<>();
            props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
            props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
            props.put(ProducerConfig.ACKS_CONFIG, "1");
            JsonSerializer<Object> serializer = new JsonSerializer<>(telemetryObjectMapper());
            serializer.setAddTypeInfo(false);
            return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
        }

        @Bean
        public KafkaTemplate<String, Object> telemetryKafkaTemplate(ProducerFactory<String, Object> telemetryProducerFactory) {
            return new KafkaTemplate<>(telemetryProducerFactory);
        }

        @Bean
        public TelemetryCollector kafkaTelemetryCollector(
                KafkaTemplate<String, Object> telemetryKafkaTemplate,
                @Value("${fraudcheck.telemetry.kafka.topic.traces:telemetry-traces}") String tracesTopic,
                @Value("${fraudcheck.telemetry.kafka.topic.metrics:telemetry-metrics}") String metricsTopic,
                @Value("${fraudcheck.telemetry.kafka.topic.logs:telemetry-logs}") String logsTopic,
                @Value("${fraudcheck.telemetry.kafka.send-timeout-ms:5000}") long sendTimeoutMs) {
            log.info("Telemetry collector: kafka (bootstrap={}, traces={}, metrics={}, logs={})",
                    bootstrapServers, tracesTopic, metricsTopic, logsTopic);
            return new KafkaTelemetryCollector(telemetryKafkaTemplate, tracesTopic, metricsTopic, logsTopic, sendTimeoutMs);
        }
    }

    /** Default collector; replaced by any other {@link TelemetryCollector} bean. */
    @Bean
    @ConditionalOnMissingBean(TelemetryCollector.class)
    public TelemetryCollector loggingTelemetryCollector() {
        log.info("Telemetry collector: logging");
        return new LoggingTelemetryCollector(telemetryObjectMapper());
    }
}
