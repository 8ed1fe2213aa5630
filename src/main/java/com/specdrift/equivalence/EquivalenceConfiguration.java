package com.specdrift.equivalence;

public record EquivalenceConfiguration(
        boolean normalizeNaming,
        boolean requireEffectOrder,
        double intentSimilarityThreshold,
        boolean useFormalSolver) {

    public static final double DEFAULT_INTENT_SIMILARITY_THRESHOLD = 0.9;

    public EquivalenceConfiguration {
        if (Double.isNaN(intentSimilarityThreshold) || intentSimilarityThreshold < 0.0 || intentSimilarityThreshold > 1.0) {
            throw new IllegalArgumentException("intentSimilarityThreshold must be within [0, 1] but was " + intentSimilarityThreshold);
        }
    }

    public static EquivalenceConfiguration defaults() {
        return new EquivalenceConfiguration(true, false, DEFAULT_INTENT_SIMILARITY_THRESHOLD, false);
    }

    public EquivalenceConfiguration withNormalizeNaming(boolean value) {
        return new EquivalenceConfiguration(value, requireEffectOrder, intentSimilarityThreshold, useFormalSolver);
    }

    public EquivalenceConfiguration withRequireEffectOrder(boolean value) {
        return new EquivalenceConfiguration(normalizeNaming, value, intentSimilarityThreshold, useFormalSolver);
    }

    public EquivalenceConfiguration withIntentSimilarityThreshold(double value) {
        return new EquivalenceConfiguration(normalizeNaming, requireEffectOrder, value, useFormalSolver);
    }
}
