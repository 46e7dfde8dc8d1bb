package com.eainde.graphagent.model;

public enum ResolutionStatus {
    PENDING,
    RESOLVED
}
