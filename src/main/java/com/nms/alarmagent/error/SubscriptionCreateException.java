package com.nms.alarmagent.error;

/**
 * The event subscription could not be created. Fatal at startup.
 */
public class SubscriptionCreateException extends AgentException {

    public SubscriptionCreateException(String message, Integer httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }

    public SubscriptionCreateException(String message) {
        super(message, null, null);
    }
}
