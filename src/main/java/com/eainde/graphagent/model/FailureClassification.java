package com.eainde.graphagent.model;

public enum FailureClassification {
    /** Same error for the same call, repeated back to back. */
    IDENTICAL,
    /** Same tool failing the same way across attempts. */
    SYSTEMATIC,
    RANDOM
}
