package com.eainde.graphagent.model;

public enum ResolutionStrategy {
    CREATE_NEW,
    USE_EXISTING,
    ASK_USER
}
