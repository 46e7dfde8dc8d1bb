package com.eainde.graphagent.error;

/**
 * No node or edge matched the requested specification.
 */
public class NotFoundException extends GraphAgentException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
