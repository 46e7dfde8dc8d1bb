package com.eainde.graphagent.model;

/**
 * Multi-dimensional confidence of a mention/candidate match. {@code overall} is
 * always derived through {@link ConfidenceWeights#combine}; use the factories.
 */
public record EntityConfidence(
        double nameMatch,
        double typeMatch,
        double propertyMatch,
        double contextMatch,
        double overall
) {
    public static EntityConfidence of(double nameMatch, double typeMatch, double propertyMatch, double contextMatch,
                                      ConfidenceWeights weights) {
        return new EntityConfidence(clamp(nameMatch), clamp(typeMatch), clamp(propertyMatch), clamp(contextMatch),
                weights.combine(clamp(nameMatch), clamp(typeMatch), clamp(propertyMatch), clamp(contextMatch)));
    }

    public static EntityConfidence exact() {
        return new EntityConfidence(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    public static EntityConfidence none() {
        return new EntityConfidence(0.0, 0.0, 0.0, 0.0, 0.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
