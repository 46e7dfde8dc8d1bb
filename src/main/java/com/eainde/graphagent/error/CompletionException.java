package com.eainde.graphagent.error;

/**
 * The completion service failed or returned output that does not match the schema.
 */
public class CompletionException extends GraphAgentException {

    public CompletionException(String message) {
        super(ErrorKind.COMPLETION, message);
    }

    public CompletionException(String message, Throwable cause) {
        super(ErrorKind.COMPLETION, message, cause);
    }
}
