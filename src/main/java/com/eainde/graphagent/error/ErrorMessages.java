package com.eainde.graphagent.error;

import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions to messages that are safe to show a user or feed back to the planner.
 * <p>
 * Backend error text never reaches the failure history for constraint and
 * not-found failures; those are rewritten into a fixed, readable form.
 * </p>
 */
public final class ErrorMessages {

    private ErrorMessages() {
    }

    public static String humanReadable(Throwable error) {
        if (error instanceof ConstraintViolationException) {
            return "The change conflicts with an existing entity that already uses the same unique value. "
                    + "Reuse the existing entity or choose a different key.";
        }
        if (error instanceof NotFoundException) {
            return "The referenced entity does not exist in the graph. "
                    + "Check the label and key, or create the entity first.";
        }
        if (error instanceof ToolNotFoundException notFound) {
            return "Unknown tool '" + notFound.getToolName() + "'. Pick one of the registered tools.";
        }
        if (error instanceof TimeoutException) {
            return "The operation timed out before the graph store answered.";
        }
        if (error instanceof GraphAgentException agentError) {
            return agentError.getMessage();
        }
        return "Unexpected error: " + error.getClass().getSimpleName();
    }

    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof GraphAgentException agentError) {
            return agentError.getKind();
        }
        if (error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.BACKEND;
    }
}
