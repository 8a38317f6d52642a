package com.nms.alarmagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nms.alarmagent.consumer.EventDecoder;
import com.nms.alarmagent.consumer.StreamConsumer;
import com.nms.alarmagent.metrics.Metrics;
import com.nms.alarmagent.output.EventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer configuration for the NMS notification bus.
 *
 * Key design decisions:
 * - Mutual TLS from PEM material (CA bundle, client certificate, client key)
 * - Automatic offset commit, reset to earliest: at-least-once delivery
 * - Client built lazily when the consumer starts, so certificate problems surface as a
 *   transport failure at startup rather than as a context failure
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaConsumerConfig {

    private final AgentProperties properties;

    @Bean
    public StreamConsumer streamConsumer(EventSink eventSink, Metrics metrics, ObjectMapper objectMapper) {
        AgentProperties.Consumer consumer = properties.getConsumer();
        return new StreamConsumer(
                () -> consumerFactory().createConsumer(),
                eventSink,
                new EventDecoder(objectMapper),
                metrics,
                consumer.getPollTimeout(),
                consumer.getShutdownTimeout()
        );
    }

    ConsumerFactory<String, byte[]> consumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerConfigs());
    }

    /**
     * Consumer configuration, TLS material included.
     */
    Map<String, Object> consumerConfigs() {
        AgentProperties.Kafka kafka = properties.getKafka();
        Map<String, Object> props = new HashMap<>();

        // Connection
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, kafka.getGroupId());
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafka.getClientId());

        // Deserialization: the value is decoded by the consumer loop so bad records can be dropped one by one
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);

        // Offset management - automatic commit, at-least-once
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        // Reliability
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000); // 5 minutes
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000); // 30 seconds
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000); // 10 seconds

        props.putAll(sslConfigs(kafka));
        return props;
    }

    Map<String, Object> sslConfigs(AgentProperties.Kafka kafka) {
        Map<String, Object> ssl = new HashMap<>();
        ssl.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");

        ssl.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, "PEM");
        ssl.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, readPem(kafka.getCaLocation()));

        ssl.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, "PEM");
        ssl.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, readPem(kafka.getCertificateLocation()));
        ssl.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, readPem(kafka.getKeyLocation()));
        if (kafka.getKeyPassword() != null && !kafka.getKeyPassword().isEmpty()) {
            ssl.put(SslConfigs.SSL_KEY_PASSWORD_CONFIG, kafka.getKeyPassword());
        }

        if (!kafka.isHostnameVerification()) {
            log.warn("Broker host name verification is DISABLED for {}. The broker certificate is still "
                    + "validated against the configured CA.", kafka.getBootstrapServers());
            ssl.put(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, "");
        }
        return ssl;
    }

    private static String readPem(String location) {
        try {
            return Files.readString(Paths.get(location), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read PEM file " + location, e);
        }
    }
}
