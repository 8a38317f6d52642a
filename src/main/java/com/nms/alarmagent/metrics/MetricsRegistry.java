package com.nms.alarmagent.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong tokenRefreshes = new AtomicLong();
    private final AtomicLong tokenRefreshFailures = new AtomicLong();
    private final AtomicLong consecutiveRefreshFailures = new AtomicLong();

    private final AtomicLong subscriptionRenewals = new AtomicLong();
    private final AtomicLong subscriptionRenewFailures = new AtomicLong();
    private final AtomicLong consecutiveRenewFailures = new AtomicLong();

    private final AtomicLong recordsReceived = new AtomicLong();
    private final AtomicLong recordsDecodeFailed = new AtomicLong();
    private final AtomicLong recordsExported = new AtomicLong();

    private final AtomicReference<Instant> lastRecordExportedAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    @Override
    public void onTokenRefreshed() {
        tokenRefreshes.incrementAndGet();
        consecutiveRefreshFailures.set(0);
        touch();
    }

    @Override
    public void onTokenRefreshFailed() {
        tokenRefreshFailures.incrementAndGet();
        consecutiveRefreshFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onSubscriptionRenewed() {
        subscriptionRenewals.incrementAndGet();
        consecutiveRenewFailures.set(0);
        touch();
    }

    @Override
    public void onSubscriptionRenewFailed() {
        subscriptionRenewFailures.incrementAndGet();
        consecutiveRenewFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onRecordReceived() {
        recordsReceived.incrementAndGet();
        touch();
    }

    @Override
    public void onRecordDecodeFailed() {
        recordsDecodeFailed.incrementAndGet();
        touch();
    }

    @Override
    public void onRecordExported() {
        recordsExported.incrementAndGet();
        Instant now = Instant.now();
        lastRecordExportedAt.set(now);
        lastUpdatedAt.set(now);
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                tokenRefreshes.get(),
                tokenRefreshFailures.get(),
                consecutiveRefreshFailures.get(),
                subscriptionRenewals.get(),
                subscriptionRenewFailures.get(),
                consecutiveRenewFailures.get(),
                recordsReceived.get(),
                recordsDecodeFailed.get(),
                recordsExported.get(),
                lastRecordExportedAt.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
