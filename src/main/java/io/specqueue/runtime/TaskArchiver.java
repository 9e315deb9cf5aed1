package io.specqueue.runtime;

import io.specqueue.config.SourceLayout;
import io.specqueue.storage.AtomicStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class TaskArchiver {
    private static final Logger log = LoggerFactory.getLogger(TaskArchiver.class);

    private final AtomicStateStore store;

    TaskArchiver(AtomicStateStore store) {
        this.store = store;
    }

    ArchiveReport archive(SourceLayout layout, String taskId, Path specFile, boolean success, String error, int attempt, Instant now) {
        List<String> warnings = new ArrayList<>();
        Path targetDir = success ? layout.archive() : layout.failed();
        Path archived = null;
        if (specFile == null || !Files.exists(specFile)) {
            warnings.add("Specification file no longer exists: " + specFile);
        } else {
            Path target = targetDir.resolve(specFile.getFileName());
            try {
                Files.createDirectories(targetDir);
                move(specFile, target);
                archived = target;
            } catch (IOException e) {
                warnings.add("Could not move " + specFile.getFileName() + " to " + targetDir + ": " + e.getMessage());
            }
        }
        if (!success) {
            Path note = layout.errorNote(taskId);
            String text = "Error: " + (error == null ? "unknown" : error) + System.lineSeparator()
                    + "Attempt: " + attempt + System.lineSeparator()
                    + "Failed at: " + now + System.lineSeparator();
            try {
                Files.createDirectories(note.getParent());
                Files.writeString(note, text, StandardCharsets.UTF_8);
            } catch (IOException e) {
                warnings.add("Could not write error note " + note + ": " + e.getMessage());
            }
        }
        for (String warning : warnings) {
            log.warn("[{}] {}", taskId, warning);
        }
        return new ArchiveReport(archived, warnings);
    }

    List<String> writeResult(SourceLayout layout, TaskResultDocument document) {
        Path target = layout.resultDocument(document.taskId());
        try {
            store.write(target, document);
            return List.of();
        } catch (IOException e) {
            String warning = "Could not write result document " + target + ": " + e.getMessage();
            log.warn("[{}] {}", document.taskId(), warning);
            return List.of(warning);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    record ArchiveReport(Path archivedPath, List<String> warnings) {
    }
}
