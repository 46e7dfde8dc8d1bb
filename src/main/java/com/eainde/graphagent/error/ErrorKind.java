package com.eainde.graphagent.error;

/**
 * Classification of failures recorded in a session's failure history.
 */
public enum ErrorKind {
    VALIDATION,
    CONSTRAINT_VIOLATION,
    NOT_FOUND,
    QUERY,
    TOOL_NOT_FOUND,
    TIMEOUT,
    TRANSIENT,
    BACKEND,
    PLANNING,
    COMPLETION,
    INTERNAL
}
