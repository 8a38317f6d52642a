package com.nms.alarmagent.consumer;

/**
 * Lifecycle of the {@link StreamConsumer}.
 *
 * DISCONNECTED -> CONNECTING -> SUBSCRIBED -> CONSUMING -> STOPPING -> DISCONNECTED
 */
public enum ConsumerState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    CONSUMING,
    STOPPING
}
