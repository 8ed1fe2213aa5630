package com.specdrift.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.specdrift.analysis.SensitivityResult;

public class RobustnessQualityGate {

    public GateEvaluation evaluate(List<SensitivityResult> results, RobustnessGatePolicy policy) {
        if (results == null || results.isEmpty()) {
            return new GateEvaluation(GateStatus.FAILED, 0.0, 0.0, List.of("No sensitivity results to evaluate"));
        }

        double averageRobustness = results.stream().mapToDouble(SensitivityResult::robustness).average().orElse(0.0);
        double averageSensitivity = results.stream().mapToDouble(SensitivityResult::sensitivity).average().orElse(0.0);

        List<String> messages = new ArrayList<>();
        GateStatus status;
        if (averageRobustness < policy.failRobustness()) {
            status = GateStatus.FAILED;
            messages.add(String.format(Locale.ROOT,
                    "Average robustness below failure threshold (actual=%.4f, min=%.4f, delta=-%.4f)",
                    averageRobustness,
                    policy.failRobustness(),
                    policy.failRobustness() - averageRobustness));
        } else if (averageRobustness < policy.warnRobustness()) {
            status = GateStatus.WARNING;
            messages.add(String.format(Locale.ROOT,
                    "Average robustness below warning threshold (actual=%.4f, min=%.4f, delta=-%.4f)",
                    averageRobustness,
                    policy.warnRobustness(),
                    policy.warnRobustness() - averageRobustness));
        } else {
            status = GateStatus.PASSED;
        }

        for (int i = 0; i < results.size(); i++) {
            SensitivityResult result = results.get(i);
            if (result.sensitivity() > policy.targetSensitivity()) {
                messages.add(String.format(Locale.ROOT,
                        "Result %d sensitivity above target (actual=%.4f, max=%.4f, delta=+%.4f)",
                        i,
                        result.sensitivity(),
                        policy.targetSensitivity(),
                        result.sensitivity() - policy.targetSensitivity()));
            }
        }

        return new GateEvaluation(status, averageRobustness, averageSensitivity, messages);
    }
}
