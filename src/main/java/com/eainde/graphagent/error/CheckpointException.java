package com.eainde.graphagent.error;

/**
 * Session state could not be written to or read from the checkpoint store.
 */
public class CheckpointException extends GraphAgentException {

    public CheckpointException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
