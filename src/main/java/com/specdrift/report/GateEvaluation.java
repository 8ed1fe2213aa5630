package com.specdrift.report;

import java.util.List;

public record GateEvaluation(
        GateStatus status,
        double averageRobustness,
        double averageSensitivity,
        List<String> messages) {

    public GateEvaluation {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public boolean passed() {
        return status != GateStatus.FAILED;
    }
}
