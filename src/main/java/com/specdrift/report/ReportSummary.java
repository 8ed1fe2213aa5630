package com.specdrift.report;

import java.util.List;

public record ReportSummary(
        String suiteName,
        String generatedAt,
        int totalResults,
        int totalVariants,
        int nonEquivalentVariants,
        double averageRobustness,
        double averageSensitivity,
        GateStatus gateStatus,
        List<String> messages) {
}
