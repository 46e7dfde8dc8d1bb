package com.eainde.graphagent.workflow;

import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.NodeName;

import java.time.Instant;
import java.util.List;

/**
 * Audit entry for one transition, handed to every {@link TransitionListener}.
 */
public record TransitionRecord(
        String sessionId,
        long version,
        NodeName from,
        NodeName to,
        SessionStatus status,
        List<String> progress,
        int failureCount,
        Instant at,
        long durationMs
) {
    public TransitionRecord {
        progress = progress == null ? List.of() : List.copyOf(progress);
    }
}
