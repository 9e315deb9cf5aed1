package io.specqueue.model;

import java.time.Instant;
import java.util.List;

public record QueueStatus(
        String version,
        String stateFile,
        String currentSource,
        Instant lastSwitch,
        List<String> sourceOrder,
        int total,
        int pending,
        int running,
        int completed,
        int failed,
        long totalQueued,
        long totalCompleted,
        long totalFailed,
        Instant lastProcessedAt,
        Instant lastLoadAt,
        Instant updatedAt,
        List<SourceStatus> sources
) {
}
