package com.eainde.graphagent.state;

import com.eainde.graphagent.model.EntityCandidate;

import java.time.Instant;
import java.util.List;

/**
 * Marks a session that waits for human input. On resume the orchestrator
 * re-enters {@code node} with the response.
 *
 * @param deadline null when the suspension never expires
 */
public record Suspension(
        SuspensionKind kind,
        NodeName node,
        String question,
        List<String> options,
        List<EntityCandidate> candidates,
        Instant deadline,
        Instant createdAt
) {
    public Suspension {
        options = options == null ? List.of() : List.copyOf(options);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean isExpired(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
