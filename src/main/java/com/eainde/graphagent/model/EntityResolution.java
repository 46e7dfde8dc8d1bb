package com.eainde.graphagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Decision for a single mention. Immutable: re-resolving a mention produces a
 * new record whose {@code supersedes} points at the old one.
 */
public record EntityResolution(
        String resolutionId,
        String mention,
        ResolutionStrategy strategy,
        String entityId,
        String entityKey,
        String entityLabel,
        EntityConfidence confidence,
        List<EntityCandidate> candidates,
        String reasoning,
        String supersedes,
        Instant resolvedAt
) {
    public EntityResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        confidence = confidence == null ? EntityConfidence.none() : confidence;
    }

    @JsonIgnore
    public boolean isAmbiguous() {
        return strategy == ResolutionStrategy.ASK_USER;
    }
}
