package com.eainde.graphagent.error;

/**
 * Malformed tool arguments, node specs or other caller input.
 */
public class ValidationException extends GraphAgentException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
