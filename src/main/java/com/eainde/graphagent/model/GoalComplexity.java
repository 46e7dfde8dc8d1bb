package com.eainde.graphagent.model;

public enum GoalComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX
}
