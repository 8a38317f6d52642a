package com.nms.alarmagent.error;

import java.util.OptionalInt;

/**
 * Base type for failures raised by the agent's lifecycle components.
 *
 * Carries the HTTP status of the remote call that failed, when there was one.
 */
public abstract class AgentException extends RuntimeException {

    private final Integer httpStatus;

    protected AgentException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public OptionalInt httpStatus() {
        return httpStatus == null ? OptionalInt.empty() : OptionalInt.of(httpStatus);
    }
}
