package io.specqueue.model;

import java.time.Instant;

public record TaskView(
        String taskId,
        String sourceId,
        TaskStatus status,
        TaskOrigin origin,
        int attempts,
        String specPath,
        String contentFingerprint,
        long fileSize,
        Instant addedAt,
        Instant startedAt,
        Instant completedAt,
        String error
) {
    public static TaskView of(TaskRecord record) {
        return new TaskView(
                record.id(),
                record.sourceId(),
                record.status(),
                record.origin(),
                record.attempts(),
                record.specPath(),
                record.contentFingerprint(),
                record.fileSize(),
                record.addedAt(),
                record.startedAt(),
                record.completedAt(),
                record.error()
        );
    }
}
