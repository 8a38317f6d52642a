package com.nms.alarmagent.error;

public class DecodeFailureException extends AgentException {

    public DecodeFailureException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
