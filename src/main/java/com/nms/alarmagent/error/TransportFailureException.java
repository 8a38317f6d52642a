package com.nms.alarmagent.error;

/**
 * Connection or TLS level failure of the message bus consumer. Ends the current consume run.
 */
public class TransportFailureException extends AgentException {

    public TransportFailureException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
