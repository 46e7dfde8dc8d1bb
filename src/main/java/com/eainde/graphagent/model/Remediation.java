package com.eainde.graphagent.model;

public enum Remediation {
    RETRY,
    INCREASE_DISCLOSURE,
    ESCALATE_SOON
}
