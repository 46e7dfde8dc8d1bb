package com.eainde.graphagent.model;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.graph.Props;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the append-only failure history.
 *
 * @param node      name of the orchestrator node that recorded the failure
 * @param stepIndex index of the plan step the failure belongs to
 * @param attempt   disclosure attempt in effect when the failure happened
 */
public record Failure(
        ErrorKind kind,
        String message,
        String node,
        String toolName,
        Map<String, Object> arguments,
        int stepIndex,
        int attempt,
        Instant timestamp
) {
    public Failure {
        arguments = Props.copyOf(arguments);
    }

    /** Same message, tool and arguments; kind, attempt and time are ignored. */
    public boolean sameAs(Failure other) {
        return other != null
                && Objects.equals(message, other.message)
                && Objects.equals(toolName, other.toolName)
                && Objects.equals(arguments, other.arguments);
    }
}
