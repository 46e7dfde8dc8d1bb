package com.eainde.graphagent.model;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.graph.Props;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Outcome of one tool call (or of a planning attempt that never reached a tool).
 * Errors are values here; the orchestrator never sees a raw exception from a tool.
 */
public record ExecutionResult(
        ExecutionStatus status,
        String toolName,
        Map<String, Object> payload,
        boolean retryable,
        String error,
        ErrorKind errorKind
) {
    public ExecutionResult {
        payload = Props.copyOf(payload);
    }

    public static ExecutionResult success(String toolName, Map<String, Object> payload) {
        return new ExecutionResult(ExecutionStatus.SUCCESS, toolName, payload, false, null, null);
    }

    public static ExecutionResult validationError(String toolName, ErrorKind kind, String error) {
        return new ExecutionResult(ExecutionStatus.VALIDATION_ERROR, toolName, Map.of(), true, error, kind);
    }

    public static ExecutionResult executionError(String toolName, ErrorKind kind, String error, boolean retryable) {
        return new ExecutionResult(ExecutionStatus.EXECUTION_ERROR, toolName, Map.of(), retryable, error, kind);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
