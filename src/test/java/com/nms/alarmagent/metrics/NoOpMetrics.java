package com.nms.alarmagent.metrics;

import java.time.Instant;

/**
 * No-op metrics implementation.
 * Used for tests that do not assert on counters.
 */
public class NoOpMetrics implements Metrics {

    /* -------- Token / subscription -------- */

    @Override
    public void onTokenRefreshed() {
        // no-op
    }

    @Override
    public void onTokenRefreshFailed() {
        // no-op
    }

    @Override
    public void onSubscriptionRenewed() {
        // no-op
    }

    @Override
    public void onSubscriptionRenewFailed() {
        // no-op
    }

    /* -------- Stream -------- */

    @Override
    public void onRecordReceived() {
        // no-op
    }

    @Override
    public void onRecordDecodeFailed() {
        // no-op
    }

    @Override
    public void onRecordExported() {
        // no-op
    }

    /* -------- Snapshot -------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                0,          // tokenRefreshes
                0,          // tokenRefreshFailures
                0,          // consecutiveRefreshFailures
                0,          // subscriptionRenewals
                0,          // subscriptionRenewFailures
                0,          // consecutiveRenewFailures
                0,          // recordsReceived
                0,          // recordsDecodeFailed
                0,          // recordsExported
                null,
                Instant.now()
        );
    }
}
