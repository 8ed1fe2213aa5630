package com.specdrift.analysis;

public record StatisticalTestResult(
        String testName,
        double statistic,
        double pValue,
        boolean significant,
        String interpretation) {
}
