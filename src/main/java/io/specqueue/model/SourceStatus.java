package io.specqueue.model;

import java.time.Instant;

public record SourceStatus(
        String sourceId,
        String path,
        boolean configured,
        int total,
        int pending,
        int running,
        int completed,
        int failed,
        String processingTaskId,
        Long processingPid,
        long totalQueued,
        long totalCompleted,
        long totalFailed,
        Instant lastProcessedAt,
        Instant lastLoadAt,
        Instant updatedAt
) {
    public static SourceStatus of(SourceState source, boolean configured) {
        ProcessingMarker processing = source.processing();
        QueueStatistics statistics = source.statistics();
        return new SourceStatus(
                source.id(),
                source.path(),
                configured,
                source.queue().size(),
                source.count(TaskStatus.PENDING),
                source.count(TaskStatus.RUNNING),
                source.count(TaskStatus.COMPLETED),
                source.count(TaskStatus.FAILED),
                processing.active() ? processing.taskId() : null,
                processing.active() ? processing.pid() : null,
                statistics.totalQueued(),
                statistics.totalCompleted(),
                statistics.totalFailed(),
                statistics.lastProcessedAt(),
                statistics.lastLoadAt(),
                source.updatedAt()
        );
    }
}
