package com.eainde.graphagent.model;

public enum EvaluationOutcome {
    /** Step succeeded and more steps remain. */
    ADVANCE,
    /** Step succeeded and the goal is done. */
    COMPLETE,
    /** Step failed and a retry is allowed. */
    RETRY,
    ESCALATE
}
