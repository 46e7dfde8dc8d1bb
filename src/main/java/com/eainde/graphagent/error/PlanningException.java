package com.eainde.graphagent.error;

/**
 * The step planner could not produce a usable tool signature.
 */
public class PlanningException extends GraphAgentException {

    public PlanningException(String message) {
        super(ErrorKind.PLANNING, message);
    }

    public PlanningException(String message, Throwable cause) {
        super(ErrorKind.PLANNING, message, cause);
    }
}
