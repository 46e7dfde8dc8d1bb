package com.eainde.graphagent.state;

public enum SuspensionKind {
    DISAMBIGUATION,
    ESCALATION
}
