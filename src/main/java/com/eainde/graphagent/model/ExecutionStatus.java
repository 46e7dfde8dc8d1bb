package com.eainde.graphagent.model;

public enum ExecutionStatus {
    SUCCESS,
    VALIDATION_ERROR,
    EXECUTION_ERROR
}
