package com.nms.alarmagent.error;

/**
 * Initial authentication against the token endpoint failed. Fatal at startup.
 */
public class AuthFailureException extends AgentException {

    public AuthFailureException(String message, Integer httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }

    public AuthFailureException(String message) {
        super(message, null, null);
    }
}
