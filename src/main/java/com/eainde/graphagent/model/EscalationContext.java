package com.eainde.graphagent.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything a human needs to unblock a session.
 *
 * @param requestingNode name of the node that asked for help
 * @param deadline       null when the escalation never times out
 */
public record EscalationContext(
        String reason,
        String summary,
        List<String> options,
        String recommendedOption,
        String requestingNode,
        ToolSignature failedSignature,
        Instant deadline
) {
    public EscalationContext {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
