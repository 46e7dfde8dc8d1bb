package com.eainde.graphagent.model;

public enum HumanResponseKind {
    SELECT_CANDIDATE,
    CREATE_NEW,
    CORRECTED_SIGNATURE,
    RETRY,
    PROVIDE_CONTEXT,
    ABORT
}
