package com.nms.alarmagent.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.nms.alarmagent.auth.TokenManager;
import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.error.SubscriptionCreateException;
import com.nms.alarmagent.error.SubscriptionRenewException;
import com.nms.alarmagent.metrics.Metrics;
import com.nms.alarmagent.scheduling.PeriodicTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates the fault-event subscription at startup and keeps it alive.
 *
 * Renewal runs on a fixed interval comfortably shorter than the subscription TTL, so one or two
 * failed renewals do not let the topic expire.
 */
@Slf4j
@Component
public class SubscriptionManager {

    private final AgentProperties.SubscriptionSettings settings;
    private final RestTemplate restTemplate;
    private final TokenManager tokenManager;
    private final SubscriptionStore subscriptionStore;
    private final Metrics metrics;
    private final Clock clock;
    private final PeriodicTask autoRenewal;

    public SubscriptionManager(
            AgentProperties properties,
            @Qualifier("nmsRestTemplate") RestTemplate restTemplate,
            TokenManager tokenManager,
            SubscriptionStore subscriptionStore,
            TaskScheduler taskScheduler,
            Metrics metrics,
            Clock clock
    ) {
        this.settings = properties.getSubscription();
        this.restTemplate = restTemplate;
        this.tokenManager = tokenManager;
        this.subscriptionStore = subscriptionStore;
        this.metrics = metrics;
        this.clock = clock;
        this.autoRenewal = new PeriodicTask("subscription-renewal", this::renewQuietly, taskScheduler, clock);
    }

    /**
     * Subscribe to a notification category, filtered by a property expression.
     *
     * @throws SubscriptionCreateException if the call fails or the response lacks an id or topic
     */
    public Subscription createSubscription(String category, String propertyFilter) {
        String url = subscriptionsUrl();
        Map<String, Object> payload = Map.of(
                "categories", List.of(Map.of(
                        "name", category,
                        "propertyFilter", propertyFilter
                ))
        );
        log.info("Creating subscription for category {} at {}", category, url);
        log.debug("Property filter: {}", propertyFilter);

        JsonNode response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(payload, bearerHeaders()), JsonNode.class).getBody();
        } catch (RestClientResponseException e) {
            throw new SubscriptionCreateException("Subscription request failed with HTTP "
                    + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException | IllegalStateException e) {
            throw new SubscriptionCreateException("Subscription request failed: " + e.getMessage(), null, e);
        }

        JsonNode data = unwrap(response);
        String subscriptionId = text(data, "subscriptionId");
        String topicId = text(data, "topicId");
        if (subscriptionId == null || topicId == null) {
            throw new SubscriptionCreateException(
                    "Subscription response lacks subscriptionId or topicId: " + response);
        }

        Subscription subscription = new Subscription(subscriptionId, topicId, expiresAtOrDefault(data));
        subscriptionStore.replace(subscription);
        log.info("Subscription created: id={}, topic={}, expiresAt={}",
                subscription.subscriptionId(), subscription.topicId(), subscription.expiresAt());
        return subscription;
    }

    public Subscription createSubscription() {
        return createSubscription(settings.getCategory(), settings.getPropertyFilter());
    }

    /**
     * Extend the current subscription. The topic stays the same; only the expiry moves.
     *
     * @throws SubscriptionRenewException if there is no subscription or the call fails
     */
    public Subscription renewSubscription() {
        Subscription current = subscriptionStore.current()
                .orElseThrow(() -> new SubscriptionRenewException("No subscription available for renewal"));

        String url = subscriptionsUrl() + "/" + current.subscriptionId() + "/renewals";
        log.info("Renewing subscription {}", current.subscriptionId());

        JsonNode response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(Map.of(), bearerHeaders()), JsonNode.class).getBody();
        } catch (RestClientResponseException e) {
            throw new SubscriptionRenewException("Renewal of " + current.subscriptionId()
                    + " failed with HTTP " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException | IllegalStateException e) {
            throw new SubscriptionRenewException("Renewal of " + current.subscriptionId()
                    + " failed: " + e.getMessage(), null, e);
        }

        Subscription renewed = current.withExpiresAt(expiresAtOrDefault(unwrap(response)));
        subscriptionStore.replace(renewed);
        log.info("Subscription {} renewed until {}", renewed.subscriptionId(), renewed.expiresAt());
        return renewed;
    }

    public void startAutoRenewal(Duration interval) {
        autoRenewal.start(interval);
    }

    public void startAutoRenewal() {
        startAutoRenewal(settings.getRenewalInterval());
    }

    public boolean stopAutoRenewal(Duration timeout) {
        return autoRenewal.cancel(timeout);
    }

    public boolean isAutoRenewalRunning() {
        return autoRenewal.isScheduled();
    }

    /**
     * Tear the subscription down. Best-effort: failures are logged, never thrown.
     *
     * @return true if the server confirmed the deletion
     */
    public boolean deleteSubscription() {
        Optional<Subscription> current = subscriptionStore.current();
        if (current.isEmpty()) {
            log.warn("No subscription available for deletion");
            return false;
        }
        String id = current.get().subscriptionId();
        log.info("Deleting subscription {}", id);
        try {
            restTemplate.exchange(subscriptionsUrl() + "/" + id, HttpMethod.DELETE,
                    new HttpEntity<>(bearerHeaders()), Void.class);
            subscriptionStore.clear();
            log.info("Subscription {} deleted", id);
            return true;
        } catch (RestClientException | IllegalStateException e) {
            log.error("Failed to delete subscription {}: {}", id, e.getMessage());
            return false;
        }
    }

    public Optional<Subscription> currentSubscription() {
        return subscriptionStore.current();
    }

    private void renewQuietly() {
        try {
            renewSubscription();
            metrics.onSubscriptionRenewed();
        } catch (SubscriptionRenewException e) {
            metrics.onSubscriptionRenewFailed();
            log.error("Auto-renewal failed, will retry on next cycle: {}", e.getMessage());
        }
    }

    private HttpHeaders bearerHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, tokenManager.currentAuthorizationHeader());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private String subscriptionsUrl() {
        return settings.getBaseUrl() + "/notifications/subscriptions";
    }

    private Instant expiresAtOrDefault(JsonNode data) {
        Instant parsed = parseExpiresAt(data == null ? null : data.get("expiresAt"));
        return parsed != null ? parsed : clock.instant().plus(settings.getTtl());
    }

    /**
     * The NMS wraps payloads as {@code {"response": {"data": {...}}}}; some gateways return the
     * fields at the top level.
     */
    static JsonNode unwrap(JsonNode response) {
        if (response == null) {
            return null;
        }
        JsonNode data = response.path("response").path("data");
        return data.isObject() ? data : response;
    }

    /**
     * Numbers are epoch milliseconds; strings are ISO-8601 offset date-times (including the
     * {@code Z} form) or numeric epoch milliseconds.
     */
    static Instant parseExpiresAt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            if (!node.isIntegralNumber() || !node.canConvertToLong()) {
                log.warn("Unusable expiresAt {}, falling back to configured TTL", node);
                return null;
            }
            return Instant.ofEpochMilli(node.asLong());
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            if (raw.chars().allMatch(c -> c >= '0' && c <= '9')) {
                return Instant.ofEpochMilli(Long.parseLong(raw));
            }
            return OffsetDateTime.parse(raw).toInstant();
        } catch (NumberFormatException | DateTimeException e) {
            log.warn("Unparseable expiresAt '{}', falling back to configured TTL", raw);
            return null;
        }
    }

    private static String text(JsonNode data, String field) {
        if (data == null) {
            return null;
        }
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
