package io.specqueue.executor;

import java.util.Map;

public record ExecutionResult(
        boolean success,
        String output,
        String error,
        Map<String, Object> usage,
        Double costUsd
) {
    public ExecutionResult {
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static ExecutionResult ok(String output) {
        return new ExecutionResult(true, output, null, Map.of(), null);
    }

    public static ExecutionResult fail(String error) {
        return new ExecutionResult(false, null, error, Map.of(), null);
    }
}
