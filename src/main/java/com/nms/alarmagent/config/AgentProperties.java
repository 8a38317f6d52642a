package com.nms.alarmagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings of the agent, bound from the {@code agent} prefix.
 *
 * <pre>
 * agent:
 *   auto-start: true
 *   api:
 *     base-url: https://nms.example.com:8443/rest-gateway/rest/api/v1
 *     username: ${NMS_API_USERNAME}
 *     password: ${NMS_API_PASSWORD}
 *     refresh-interval: 50m
 *     token-lifetime: 60m
 *   subscription:
 *     base-url: https://nms.example.com:8544/nbi-notification/api/v1
 *     renewal-interval: 30m
 *     ttl: 56m
 *   kafka:
 *     bootstrap-servers: nms.example.com:9193
 *     group-id: nms-alarm-agent
 *   export:
 *     file: logs/kafka_messages.jsonl
 * </pre>
 *
 * Refresh and renewal are interval-driven. {@link #validate()} rejects intervals that are not
 * strictly shorter than the lifetime they guard.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    /**
     * Start the lifecycle together with the application context.
     */
    private boolean autoStart = true;

    private Api api = new Api();
    private SubscriptionSettings subscription = new SubscriptionSettings();
    private Kafka kafka = new Kafka();
    private Export export = new Export();
    private Consumer consumer = new Consumer();

    @Data
    public static class Api {
        private String baseUrl = "https://localhost:8443/rest-gateway/rest/api/v1";
        private String username;
        private String password;
        private Duration refreshInterval = Duration.ofMinutes(50);
        /**
         * Advertised lifetime of an access token. Only used to validate the refresh interval.
         */
        private Duration tokenLifetime = Duration.ofMinutes(60);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        /**
         * Name of a Spring Boot SSL bundle used for the REST calls; JVM trust store when unset.
         */
        private String sslBundle;
    }

    @Data
    public static class SubscriptionSettings {
        private String baseUrl = "https://localhost:8544/nbi-notification/api/v1";
        private String category = "NSP-FAULT";
        private String propertyFilter = "severity = 'warning'";
        private Duration renewalInterval = Duration.ofMinutes(30);
        /**
         * Time-to-live the server grants a subscription.
         */
        private Duration ttl = Duration.ofMillis(3_400_000);
    }

    @Data
    public static class Kafka {
        private String bootstrapServers = "localhost:9193";
        private String groupId = "nms-alarm-agent";
        private String clientId = "alarm-agent";
        private String caLocation = "config/certs/ca.pem";
        private String certificateLocation = "config/certs/client.pem";
        private String keyLocation = "config/certs/key.pem";
        private String keyPassword;
        /**
         * Verify the broker host name against its certificate. Only disable for
         * self-signed deployment certificates.
         */
        private boolean hostnameVerification = true;
    }

    @Data
    public static class Export {
        private String file = "logs/kafka_messages.jsonl";
        private boolean fsync = true;
    }

    @Data
    public static class Consumer {
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    /**
     * Fail fast on settings that would let a token or subscription expire under normal operation.
     *
     * @throws IllegalStateException listing every violation
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        requirePositive(problems, "agent.api.refresh-interval", api.getRefreshInterval());
        requirePositive(problems, "agent.api.token-lifetime", api.getTokenLifetime());
        requirePositive(problems, "agent.subscription.renewal-interval", subscription.getRenewalInterval());
        requirePositive(problems, "agent.subscription.ttl", subscription.getTtl());

        if (isPositive(api.getRefreshInterval()) && isPositive(api.getTokenLifetime())
                && api.getRefreshInterval().compareTo(api.getTokenLifetime()) >= 0) {
            problems.add("agent.api.refresh-interval (" + api.getRefreshInterval()
                    + ") must be shorter than agent.api.token-lifetime (" + api.getTokenLifetime() + ")");
        }
        if (isPositive(subscription.getRenewalInterval()) && isPositive(subscription.getTtl())
                && subscription.getRenewalInterval().compareTo(subscription.getTtl()) >= 0) {
            problems.add("agent.subscription.renewal-interval (" + subscription.getRenewalInterval()
                    + ") must be shorter than agent.subscription.ttl (" + subscription.getTtl() + ")");
        }

        requireText(problems, "agent.api.base-url", api.getBaseUrl());
        requireText(problems, "agent.api.username", api.getUsername());
        requireText(problems, "agent.api.password", api.getPassword());
        requireText(problems, "agent.subscription.base-url", subscription.getBaseUrl());
        requireText(problems, "agent.subscription.category", subscription.getCategory());
        requireText(problems, "agent.kafka.bootstrap-servers", kafka.getBootstrapServers());
        requireText(problems, "agent.kafka.group-id", kafka.getGroupId());
        requireText(problems, "agent.export.file", export.getFile());

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid agent configuration: " + String.join("; ", problems));
        }
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (!isPositive(value)) {
            problems.add(name + " must be a positive duration");
        }
    }

    private static boolean isPositive(Duration value) {
        return value != null && !value.isNegative() && !value.isZero();
    }

    private static void requireText(List<String> problems, String name, String value) {
        if (value == null || value.isBlank()) {
            problems.add(name + " is required");
        }
    }
}
