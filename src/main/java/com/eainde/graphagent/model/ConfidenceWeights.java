package com.eainde.graphagent.model;

/**
 * Weights of the four confidence dimensions. They need not sum to one; the
 * combined score is normalized by their sum.
 */
public record ConfidenceWeights(double name, double type, double property, double context) {

    public ConfidenceWeights {
        if (name < 0 || type < 0 || property < 0 || context < 0) {
            throw new IllegalArgumentException("Confidence weights must be non-negative");
        }
        if (name + type + property + context <= 0) {
            throw new IllegalArgumentException("At least one confidence weight must be positive");
        }
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.4, 0.3, 0.2, 0.1);
    }

    public double combine(double nameMatch, double typeMatch, double propertyMatch, double contextMatch) {
        double total = name + type + property + context;
        double weighted = nameMatch * name + typeMatch * type + propertyMatch * property + contextMatch * context;
        return Math.max(0.0, Math.min(1.0, weighted / total));
    }
}
