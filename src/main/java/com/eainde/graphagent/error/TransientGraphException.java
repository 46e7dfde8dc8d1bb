package com.eainde.graphagent.error;

/**
 * A temporary backend failure (connection reset, lock timeout). Safe to retry.
 */
public class TransientGraphException extends GraphAgentException {

    public TransientGraphException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientGraphException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
