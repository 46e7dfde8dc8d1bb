package com.eainde.graphagent.error;

/**
 * A uniqueness constraint of the graph store rejected an upsert.
 */
public class ConstraintViolationException extends GraphAgentException {

    public ConstraintViolationException(String message) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message, cause);
    }
}
