package io.specqueue.config;

import java.nio.file.Path;

public record SourceLayout(Path root, Path pending, Path archive, Path failed, Path results) {
    public static SourceLayout of(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        return new SourceLayout(
                normalized,
                normalized.resolve("pending"),
                normalized.resolve("archive"),
                normalized.resolve("failed"),
                normalized.resolve("results")
        );
    }

    public Path errorNote(String taskId) {
        return failed.resolve(taskId + ".error.txt");
    }

    public Path resultDocument(String taskId) {
        return results.resolve(taskId + ".json");
    }
}
