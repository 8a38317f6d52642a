package com.nms.alarmagent.error;

/**
 * A subscription renewal call failed. Retried on the next renewal interval.
 */
public class SubscriptionRenewException extends AgentException {

    public SubscriptionRenewException(String message, Integer httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }

    public SubscriptionRenewException(String message) {
        super(message, null, null);
    }
}
