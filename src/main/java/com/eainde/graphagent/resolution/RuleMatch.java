package com.eainde.graphagent.resolution;

import com.eainde.graphagent.model.EntityCandidate;

/**
 * A candidate that a resolution rule matched exactly, with the rule that fired.
 */
public record RuleMatch(EntityCandidate candidate, String rule) {
}
