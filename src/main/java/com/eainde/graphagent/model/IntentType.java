package com.eainde.graphagent.model;

public enum IntentType {
    CREATE,
    QUERY,
    UPDATE,
    DELETE,
    UNKNOWN
}
