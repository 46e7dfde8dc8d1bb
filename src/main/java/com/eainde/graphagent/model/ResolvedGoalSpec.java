package com.eainde.graphagent.model;

import com.eainde.graphagent.error.AmbiguousEntityException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An {@link IntentSpec} whose mentions have been bound against the graph.
 * {@code readyToExecute} holds exactly when no ambiguity is pending.
 */
public record ResolvedGoalSpec(
        String goal,
        IntentSpec intent,
        List<EntityResolution> resolutions,
        List<AmbiguityResolution> ambiguities,
        boolean readyToExecute
) {
    public ResolvedGoalSpec {
        resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
        ambiguities = ambiguities == null ? List.of() : List.copyOf(ambiguities);
        readyToExecute = ambiguities.stream().noneMatch(AmbiguityResolution::isPending);
    }

    public static ResolvedGoalSpec of(IntentSpec intent, List<EntityResolution> resolutions) {
        List<AmbiguityResolution> ambiguities = new ArrayList<>();
        for (EntityResolution resolution : resolutions) {
            if (resolution.isAmbiguous()) {
                ambiguities.add(new AmbiguityResolution(resolution.mention(), questionFor(resolution),
                        resolution.candidates(), ResolutionStatus.PENDING, null, resolution.resolutionId()));
            }
        }
        return new ResolvedGoalSpec(intent.goal(), intent, resolutions, ambiguities, ambiguities.isEmpty());
    }

    @JsonIgnore
    public List<AmbiguityResolution> pendingAmbiguities() {
        return ambiguities.stream().filter(AmbiguityResolution::isPending).toList();
    }

    public Optional<EntityResolution> resolutionFor(String mention) {
        return resolutions.stream().filter(r -> r.mention().equals(mention)).findFirst();
    }

    /**
     * Returns the bindings, failing if any mention still waits for a human choice.
     */
    public List<EntityResolution> requireBindings() {
        List<AmbiguityResolution> pending = pendingAmbiguities();
        if (!pending.isEmpty()) {
            throw new AmbiguousEntityException(pending.stream().map(AmbiguityResolution::mention).toList());
        }
        return resolutions;
    }

    /**
     * Replaces the resolution of the same mention and closes its ambiguity.
     */
    public ResolvedGoalSpec withResolution(EntityResolution replacement) {
        List<EntityResolution> updated = new ArrayList<>();
        for (EntityResolution resolution : resolutions) {
            updated.add(resolution.mention().equals(replacement.mention()) ? replacement : resolution);
        }
        List<AmbiguityResolution> closed = new ArrayList<>();
        for (AmbiguityResolution ambiguity : ambiguities) {
            closed.add(ambiguity.mention().equals(replacement.mention()) && ambiguity.isPending()
                    ? ambiguity.resolved(replacement.entityId())
                    : ambiguity);
        }
        return new ResolvedGoalSpec(goal, intent, updated, closed, false);
    }

    private static String questionFor(EntityResolution resolution) {
        StringBuilder question = new StringBuilder("Which entity did you mean by '")
                .append(resolution.mention()).append("'?");
        for (int i = 0; i < resolution.candidates().size(); i++) {
            EntityCandidate candidate = resolution.candidates().get(i);
            question.append(' ').append(i + 1).append(") ").append(candidate.name())
                    .append(" [").append(candidate.label()).append(':').append(candidate.key()).append(']');
        }
        return question.toString();
    }
}
