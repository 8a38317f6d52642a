package com.nms.alarmagent.orchestrator;

public enum Health {
    /** Token valid, subscription live, consumer receiving. */
    UP,
    /** Running, but the token or subscription has lapsed or the consumer is not receiving. */
    DEGRADED,
    /** Not started, or shut down. */
    DOWN
}
