package com.nms.alarmagent.orchestrator;

import com.nms.alarmagent.consumer.ConsumerState;

import java.time.Instant;

/**
 * Point-in-time view of the agent for the health/status query.
 */
public record AgentStatus(
        Health health,
        boolean running,

        /* -------- Token -------- */
        boolean tokenValid,
        Instant tokenExpiresAt,
        long consecutiveRefreshFailures,

        /* -------- Subscription -------- */
        String subscriptionId,
        String topicId,
        Instant subscriptionExpiresAt,
        long consecutiveRenewFailures,

        /* -------- Consumer -------- */
        ConsumerState consumerState,
        long recordsReceived,
        String lastTransportFailure,

        /* -------- Event log -------- */
        long eventLogRecords,
        long eventLogBytes
) {}
