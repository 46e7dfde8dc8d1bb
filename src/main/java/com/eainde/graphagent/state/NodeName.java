package com.eainde.graphagent.state;

/**
 * Nodes of the goal workflow. {@link #END} is the sink reached after a terminal node.
 */
public enum NodeName {
    PARSE_INTENT,
    RESOLVE_ENTITIES,
    DISAMBIGUATE,
    PLAN_STEP,
    EXECUTE_TOOL,
    EVALUATE,
    DIAGNOSE,
    ESCALATE,
    ANSWER,
    ESCALATION_TIMEOUT,
    END
}
