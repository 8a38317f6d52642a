package com.nms.alarmagent.error;

/**
 * A refresh-grant call failed. The previous credential stays in place.
 */
public class RefreshFailureException extends AgentException {

    public RefreshFailureException(String message, Integer httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }

    public RefreshFailureException(String message) {
        super(message, null, null);
    }
}
