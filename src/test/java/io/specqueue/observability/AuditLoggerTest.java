package io.specqueue.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.specqueue.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsFormAVerifiableHashChain() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-audit-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"));
            Assertions.assertEquals("", audit.currentHash());

            audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_ENQUEUE, "main", "task-20250101-120000", "pending"));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("attempt", 1);
            details.put("durationSeconds", 0.25);
            details.put("error", null);
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_FAIL, "main", "task-20250101-120000", "failed", details));
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.SOURCE_UNLOAD, "main", null, "removed", Map.of("tasks", 1)));

            List<String> lines = Files.readAllLines(audit.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("", first.path("prev_hash").asText());
            Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            Assertions.assertEquals("task.fail", second.path("action").asText());
            Assertions.assertEquals(1, second.path("details").path("attempt").asInt());

            AuditLogger.VerifyResult result = audit.verify();
            Assertions.assertTrue(result.valid());
            Assertions.assertEquals(3, result.rows());
            Assertions.assertEquals(Jsons.mapper().readTree(lines.get(2)).path("hash").asText(), audit.currentHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-audit-tamper-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_DISPATCH, "main", "task-20250101-120000", "running"));
            audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_COMPLETE, "main", "task-20250101-120000", "completed"));

            List<String> lines = Files.readAllLines(audit.auditFile(), StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"completed\"", "\"failed\""));
            Files.write(audit.auditFile(), lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = audit.verify();
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals(1, result.rows());
            Assertions.assertEquals(2, result.brokenLine());
            Assertions.assertEquals("hash mismatch", result.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-audit-gap-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            for (int i = 0; i < 3; i++) {
                audit.log(AuditLogger.AuditEvent.of(AuditLogger.TASK_ENQUEUE, "main", "task-20250101-12000" + i, "pending"));
            }
            List<String> lines = Files.readAllLines(audit.auditFile(), StandardCharsets.UTF_8);
            lines.remove(1);
            Files.write(audit.auditFile(), lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = audit.verify();
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals("prev_hash mismatch", result.reason());
            Assertions.assertEquals(2, result.brokenLine());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
