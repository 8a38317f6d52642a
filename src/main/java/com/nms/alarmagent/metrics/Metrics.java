package com.nms.alarmagent.metrics;

/**
 * Lightweight metrics API used by the lifecycle components and exposed via /metrics.
 */
public interface Metrics {

    void onTokenRefreshed();

    void onTokenRefreshFailed();

    void onSubscriptionRenewed();

    void onSubscriptionRenewFailed();

    void onRecordReceived();

    void onRecordDecodeFailed();

    void onRecordExported();

    MetricsSnapshot snapshot();
}
