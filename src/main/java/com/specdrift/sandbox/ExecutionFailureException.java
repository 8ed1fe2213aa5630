package com.specdrift.sandbox;

import java.util.Objects;

public class ExecutionFailureException extends Exception {
    public enum Reason {
        LAUNCH_FAILED,
        TIMED_OUT,
        INTERRUPTED,
        NON_ZERO_EXIT,
        MALFORMED_OUTPUT,
        PREPARATION_FAILED
    }

    private final Reason reason;

    public ExecutionFailureException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ExecutionFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
