package com.eainde.graphagent.resolution;

import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityMention;

import java.util.List;
import java.util.Optional;

/**
 * Deterministic rules applied before any scoring.
 */
public interface ResolutionRules {

    /**
     * Finds a candidate whose natural key, id or unique-key property equals the mention.
     * A hit short-circuits scoring.
     */
    Optional<RuleMatch> exactMatch(EntityMention mention, List<EntityCandidate> candidates);

    /**
     * Drops candidates that cannot be the referent: incompatible type, or neither
     * name nor property evidence.
     */
    List<EntityCandidate> matchCandidates(EntityMention mention, List<EntityCandidate> candidates);
}
