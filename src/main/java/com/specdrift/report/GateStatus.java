package com.specdrift.report;

public enum GateStatus {
    PASSED,
    WARNING,
    FAILED
}
