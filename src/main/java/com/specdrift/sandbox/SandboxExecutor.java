package com.specdrift.sandbox;

import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;

public interface SandboxExecutor {
    JsonNode execute(String source, String functionName, JsonNode input, Duration timeout)
            throws ExecutionFailureException;
}
