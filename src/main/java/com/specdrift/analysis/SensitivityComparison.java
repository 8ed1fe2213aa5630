package com.specdrift.analysis;

public record SensitivityComparison(
        double sensitivityDiff,
        double robustnessDiff,
        double sensitivityChangePct,
        double robustnessChangePct) {

    public static SensitivityComparison between(SensitivityResult reference, SensitivityResult other) {
        double sensitivityDiff = other.sensitivity() - reference.sensitivity();
        double robustnessDiff = other.robustness() - reference.robustness();
        return new SensitivityComparison(
                sensitivityDiff,
                robustnessDiff,
                reference.sensitivity() > 0 ? sensitivityDiff / reference.sensitivity() * 100 : 0.0,
                reference.robustness() > 0 ? robustnessDiff / reference.robustness() * 100 : 0.0);
    }
}
