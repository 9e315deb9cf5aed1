package io.specqueue.scan;

import java.nio.file.Path;
import java.time.Instant;

public record DiscoveredTask(
        String taskId,
        Path specFile,
        String sourceId,
        String fingerprint,
        long fileSize,
        Instant discoveredAt
) {
}
