package com.eainde.graphagent.resolution;

/**
 * How near-duplicate candidates are folded into one.
 */
public enum MergeStrategy {
    /** The most recently updated candidate wins conflicts. */
    PRESERVE_LATEST,
    /** The candidate with the fewest missing properties wins; the longer value wins remaining conflicts. */
    PRESERVE_MOST_COMPLETE,
    /** Candidates from higher-ranked sources win. */
    PRESERVE_MOST_AUTHORITATIVE,
    /** A {@link PropertyConflictResolver} decides every conflicting property. */
    CUSTOM
}
