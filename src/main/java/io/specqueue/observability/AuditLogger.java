package io.specqueue.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.specqueue.storage.InterprocessLock;
import io.specqueue.util.Hashing;
import io.specqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only JSONL journal of queue lifecycle events.
 *
 * <p>Every row carries the hash of the previous row ({@code prev_hash}) and its own SHA-256
 * ({@code hash}), so an edited or dropped row breaks the chain that {@link #verify()} walks.
 * Appends from several processes are serialized through {@code audit.lock}.
 */
public final class AuditLogger {
    public static final String TASK_ENQUEUE = "task.enqueue";
    public static final String TASK_REQUEUE = "task.requeue";
    public static final String TASK_DISPATCH = "task.dispatch";
    public static final String TASK_COMPLETE = "task.complete";
    public static final String TASK_FAIL = "task.fail";
    public static final String TASK_RECLAIM = "task.reclaim";
    public static final String SOURCE_UNLOAD = "source.unload";

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Duration APPEND_LOCK_TIMEOUT = Duration.ofSeconds(5);
    private static final int TAIL_WINDOW_BYTES = 64 * 1024;

    private final Path auditFile;
    private final Path lockFile;
    private final Clock clock;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.lockFile = auditFile.resolveSibling("audit.lock");
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        try (InterprocessLock lock = new InterprocessLock(lockFile)) {
            if (!lock.acquire(APPEND_LOCK_TIMEOUT)) {
                log.warn("Audit event {} dropped: {} is busy", event.action(), lockFile);
                return;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Instant.now(clock).toString());
            row.put("action", event.action());
            row.put("source_id", event.sourceId());
            row.put("task_id", event.taskId());
            row.put("result", event.result());
            row.put("details", event.details());
            row.put("prev_hash", lastHash());
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write audit event {}: {}", event.action(), e.getMessage());
        }
    }

    public synchronized String currentHash() {
        try {
            return lastHash();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public synchronized VerifyResult verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String previous = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            LinkedHashMap<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, new TypeReference<LinkedHashMap<String, Object>>() {
                });
            } catch (IOException e) {
                return VerifyResult.broken(rows, lineNumber, "unparsable row");
            }
            Object storedHash = row.remove("hash");
            if (!previous.equals(String.valueOf(row.get("prev_hash")))) {
                return VerifyResult.broken(rows, lineNumber, "prev_hash mismatch");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                return VerifyResult.broken(rows, lineNumber, "hash mismatch");
            }
            previous = recomputed;
            rows++;
        }
        return VerifyResult.ok(rows);
    }

    private String lastHash() throws IOException {
        if (!Files.exists(auditFile)) {
            return "";
        }
        String last = "";
        try (RandomAccessFile file = new RandomAccessFile(auditFile.toFile(), "r")) {
            long length = file.length();
            if (length == 0L) {
                return "";
            }
            int window = (int) Math.min(length, TAIL_WINDOW_BYTES);
            byte[] tail = new byte[window];
            file.seek(length - window);
            file.readFully(tail);
            String text = new String(tail, StandardCharsets.UTF_8);
            for (String line : text.split("\\R")) {
                if (!line.isBlank()) {
                    last = line;
                }
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} ends with an unparsable row; restarting the chain", auditFile);
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String sourceId,
            String taskId,
            String result,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(details));
        }

        public static AuditEvent of(String action, String sourceId, String taskId, String result) {
            return new AuditEvent(action, sourceId, taskId, result, Map.of());
        }

        public static AuditEvent of(String action, String sourceId, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, sourceId, taskId, result, details);
        }
    }

    public record VerifyResult(boolean valid, int rows, Integer brokenLine, String reason) {
        static VerifyResult ok(int rows) {
            return new VerifyResult(true, rows, null, null);
        }

        static VerifyResult broken(int rows, int line, String reason) {
            return new VerifyResult(false, rows, line, reason);
        }
    }
}
