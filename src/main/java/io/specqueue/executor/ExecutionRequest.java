package io.specqueue.executor;

import java.nio.file.Path;

public record ExecutionRequest(
        String taskId,
        String sourceId,
        Path specPath,
        String payload,
        Path workingDirectory,
        int attempt
) {
}
