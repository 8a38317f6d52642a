package com.nms.alarmagent.orchestrator;

import com.nms.alarmagent.auth.Credential;
import com.nms.alarmagent.auth.TokenManager;
import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.consumer.StreamConsumer;
import com.nms.alarmagent.metrics.Metrics;
import com.nms.alarmagent.metrics.MetricsSnapshot;
import com.nms.alarmagent.output.EventSink;
import com.nms.alarmagent.subscription.Subscription;
import com.nms.alarmagent.subscription.SubscriptionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Wires the token, subscription and consumer lifecycles together.
 *
 * Startup is all-or-nothing: any failure tears down what was already started and propagates,
 * which stops the application context. Shutdown is best-effort: every step runs even if an
 * earlier one failed.
 */
@Slf4j
@Component
public class AgentOrchestrator implements SmartLifecycle {

    private static final Duration TASK_CANCEL_TIMEOUT = Duration.ofSeconds(5);

    private final AgentProperties properties;
    private final TokenManager tokenManager;
    private final SubscriptionManager subscriptionManager;
    private final StreamConsumer streamConsumer;
    private final EventSink eventSink;
    private final Metrics metrics;
    private final Clock clock;

    private volatile boolean running;

    public AgentOrchestrator(
            AgentProperties properties,
            TokenManager tokenManager,
            SubscriptionManager subscriptionManager,
            StreamConsumer streamConsumer,
            EventSink eventSink,
            Metrics metrics,
            Clock clock
    ) {
        this.properties = properties;
        this.tokenManager = tokenManager;
        this.subscriptionManager = subscriptionManager;
        this.streamConsumer = streamConsumer;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Authenticate, subscribe, start consuming and schedule the background renewals.
     */
    @Override
    public synchronized void start() {
        if (running) {
            log.info("Agent is already running");
            return;
        }
        log.info("Alarm agent starting...");
        properties.validate();

        try {
            tokenManager.acquireInitial();
            tokenManager.startAutoRefresh(properties.getApi().getRefreshInterval());

            Subscription subscription = subscriptionManager.createSubscription(
                    properties.getSubscription().getCategory(),
                    properties.getSubscription().getPropertyFilter());

            streamConsumer.start(subscription.topicId());
            subscriptionManager.startAutoRenewal(properties.getSubscription().getRenewalInterval());
        } catch (RuntimeException e) {
            log.error("Alarm agent initialization failed: {}", e.getMessage());
            teardown();
            throw e;
        }

        running = true;
        Subscription subscription = subscriptionManager.currentSubscription().orElseThrow();
        log.info("Alarm agent started. Subscription {} on topic {}, listening for fault events",
                subscription.subscriptionId(), subscription.topicId());
    }

    @Override
    public synchronized void stop() {
        shutdown();
    }

    /**
     * Stop consuming, cancel renewals, delete the subscription and revoke the token, in that order.
     * Idempotent.
     */
    public synchronized void shutdown() {
        if (!running) {
            log.info("Agent is not running");
            return;
        }
        log.info("Alarm agent shutting down...");
        teardown();
        running = false;
        log.info("Alarm agent shutdown complete");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    /**
     * Start after everything else, stop before everything else.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    public AgentStatus status() {
        Optional<Credential> credential = tokenManager.currentCredential();
        Optional<Subscription> subscription = subscriptionManager.currentSubscription();
        MetricsSnapshot snapshot = metrics.snapshot();
        boolean tokenValid = tokenManager.isTokenValid();

        return new AgentStatus(
                health(tokenValid, subscription),
                running,
                tokenValid,
                credential.map(Credential::expiresAt).orElse(null),
                snapshot.consecutiveRefreshFailures(),
                subscription.map(Subscription::subscriptionId).orElse(null),
                subscription.map(Subscription::topicId).orElse(null),
                subscription.map(Subscription::expiresAt).orElse(null),
                snapshot.consecutiveRenewFailures(),
                streamConsumer.state(),
                streamConsumer.receivedCount(),
                streamConsumer.lastFailure().map(Throwable::getMessage).orElse(null),
                eventSink.count(),
                eventSink.sizeBytes()
        );
    }

    /**
     * Repeated refresh or renewal failures are reported in the status but do not by themselves
     * degrade health; health degrades once the token or subscription has actually lapsed, or the
     * consumer is no longer receiving.
     */
    private Health health(boolean tokenValid, Optional<Subscription> subscription) {
        if (!running) {
            return Health.DOWN;
        }
        Instant now = clock.instant();
        boolean subscriptionLive = subscription
                .map(s -> s.expiresAt() == null || s.expiresAt().isAfter(now))
                .orElse(false);
        if (tokenValid && subscriptionLive && streamConsumer.isConsuming()) {
            return Health.UP;
        }
        return Health.DEGRADED;
    }

    private void teardown() {
        step("stop consumer", streamConsumer::stop);
        step("cancel token refresh", () -> tokenManager.stopAutoRefresh(TASK_CANCEL_TIMEOUT));
        step("cancel subscription renewal", () -> subscriptionManager.stopAutoRenewal(TASK_CANCEL_TIMEOUT));
        step("delete subscription", subscriptionManager::deleteSubscription);
        step("revoke token", tokenManager::revoke);
    }

    private static void step(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Shutdown step '{}' failed, continuing", name, e);
        }
    }
}
