package com.nms.alarmagent.subscription;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link Subscription}. Written only by {@link SubscriptionManager}.
 */
@Component
public class SubscriptionStore {

    private final AtomicReference<Subscription> current = new AtomicReference<>();

    public Optional<Subscription> current() {
        return Optional.ofNullable(current.get());
    }

    void replace(Subscription subscription) {
        current.set(subscription);
    }

    void clear() {
        current.set(null);
    }
}
