package com.eainde.graphagent.error;

/**
 * Base class for all errors raised by the agent core.
 * <p>
 * Every subtype carries an {@link ErrorKind} so the orchestrator can record it
 * in the failure history without inspecting the concrete class.
 * </p>
 */
public abstract class GraphAgentException extends RuntimeException {

    private final ErrorKind kind;

    protected GraphAgentException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GraphAgentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
