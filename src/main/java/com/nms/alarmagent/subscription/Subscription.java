package com.nms.alarmagent.subscription;

import java.time.Instant;

/**
 * A server-side event subscription and the topic it publishes to.
 *
 * The topic is fixed for the lifetime of the subscription; renewal only moves {@code expiresAt}.
 */
public record Subscription(
        String subscriptionId,
        String topicId,
        Instant expiresAt
) {

    public Subscription withExpiresAt(Instant newExpiresAt) {
        return new Subscription(subscriptionId, topicId, newExpiresAt);
    }
}
