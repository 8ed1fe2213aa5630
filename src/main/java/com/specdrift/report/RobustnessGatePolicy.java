package com.specdrift.report;

public record RobustnessGatePolicy(double warnRobustness, double failRobustness, double targetSensitivity) {

    public RobustnessGatePolicy {
        if (failRobustness > warnRobustness) {
            throw new IllegalArgumentException("failRobustness must not exceed warnRobustness");
        }
    }

    public static RobustnessGatePolicy defaults() {
        return new RobustnessGatePolicy(0.90, 0.80, 0.03);
    }
}
