package io.specqueue.runtime;

import io.specqueue.model.TaskStatus;

import java.time.Instant;
import java.util.Map;

public record TaskResultDocument(
        String taskId,
        String sourceId,
        String specPath,
        boolean success,
        TaskStatus status,
        int attempts,
        Instant startedAt,
        Instant completedAt,
        double durationSeconds,
        String output,
        String error,
        Map<String, Object> usage,
        Double costUsd,
        String archivedPath
) {
}
