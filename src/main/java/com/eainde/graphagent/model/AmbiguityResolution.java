package com.eainde.graphagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A mention waiting for a human choice between candidates.
 */
public record AmbiguityResolution(
        String mention,
        String question,
        List<EntityCandidate> candidates,
        ResolutionStatus status,
        String chosenCandidateId,
        String resolutionId
) {
    public AmbiguityResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ResolutionStatus.PENDING;
    }

    public AmbiguityResolution resolved(String candidateId) {
        return new AmbiguityResolution(mention, question, candidates, ResolutionStatus.RESOLVED, candidateId, resolutionId);
    }
}
