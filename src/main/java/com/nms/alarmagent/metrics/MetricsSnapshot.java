package com.nms.alarmagent.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of agent metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "not yet happened"
 */
public record MetricsSnapshot(

        /* -------- Token lifecycle -------- */
        long tokenRefreshes,
        long tokenRefreshFailures,
        long consecutiveRefreshFailures,

        /* -------- Subscription lifecycle -------- */
        long subscriptionRenewals,
        long subscriptionRenewFailures,
        long consecutiveRenewFailures,

        /* -------- Stream -------- */
        long recordsReceived,
        long recordsDecodeFailed,
        long recordsExported,
        Instant lastRecordExportedAt,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
