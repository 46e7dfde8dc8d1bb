package com.eainde.graphagent.resolution;

/**
 * Decision thresholds of {@link GraphAwareEntityResolver}.
 *
 * @param useExistingThreshold           best score above which the existing entity is used
 * @param createNewThreshold             best score below which a new entity is created
 * @param singleCandidateAcceptThreshold lone in-band candidate accepted from this score on
 * @param tieTolerance                   scores this close to the best count as tied
 * @param deduplicationThreshold         pairwise similarity at which tied candidates merge
 * @param maxAskCandidates               candidates offered when asking the user
 */
public record ResolutionSettings(
        double useExistingThreshold,
        double createNewThreshold,
        double singleCandidateAcceptThreshold,
        double tieTolerance,
        double deduplicationThreshold,
        int maxAskCandidates,
        MergeStrategy mergeStrategy
) {
    public ResolutionSettings {
        if (createNewThreshold > useExistingThreshold) {
            throw new IllegalArgumentException("createNewThreshold must not exceed useExistingThreshold");
        }
        if (maxAskCandidates < 1) {
            throw new IllegalArgumentException("maxAskCandidates must be positive");
        }
    }

    public static ResolutionSettings defaults() {
        return new ResolutionSettings(0.95, 0.3, 0.7, 0.02, DeduplicationEngine.DEFAULT_THRESHOLD, 5,
                MergeStrategy.PRESERVE_MOST_COMPLETE);
    }
}
