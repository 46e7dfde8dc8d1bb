package com.eainde.graphagent.model;

public enum SessionStatus {
    RUNNING,
    AWAITING_INPUT,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }
}
