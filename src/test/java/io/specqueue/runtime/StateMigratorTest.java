package io.specqueue.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.specqueue.model.QueueState;
import io.specqueue.model.SourceState;
import io.specqueue.model.TaskOrigin;
import io.specqueue.model.TaskRecord;
import io.specqueue.model.TaskStatus;
import io.specqueue.storage.QueueStateException;
import io.specqueue.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class StateMigratorTest {
    private static final String LEGACY = """
            {
              "version": "1.0",
              "queue": [
                {
                  "task_id": "task-20250101-100000-a",
                  "spec_file": "/work/main/pending/task-20250101-100000-a.md",
                  "spec_dir_id": "main",
                  "status": "completed",
                  "source": "watchdog",
                  "file_hash": "abc",
                  "file_size": 12,
                  "added_at": "2025-01-01T10:00:00",
                  "completed_at": "2025-01-01T10:05:00+02:00"
                },
                {
                  "task_id": "task-20250101-110000-b",
                  "task_doc_file": "/work/aux/pending/task-20250101-110000-b.md",
                  "task_doc_dir_id": "aux",
                  "status": "running",
                  "added_at": "not a timestamp"
                },
                {
                  "task_id": "task-20250101-120000-c",
                  "spec_file": "/work/main/pending/task-20250101-120000-c.md",
                  "spec_dir_id": "main",
                  "status": "failed",
                  "error": "boom"
                },
                {
                  "task_id": "task-20250101-130000-d",
                  "spec_file": "/loose/task-20250101-130000-d.md",
                  "status": "pending"
                }
              ],
              "processing": {
                "is_processing": true,
                "current_task": "task-20250101-110000-b",
                "process_id": 321,
                "started_at": "2025-01-01T11:00:00Z"
              },
              "statistics": {
                "total_queued": 9,
                "total_completed": 4,
                "total_failed": 2
              }
            }
            """;

    @Test
    void legacyQueueIsGroupedBySourceInFirstSeenOrder() throws Exception {
        StateMigrator migrator = new StateMigrator(ZoneOffset.UTC);
        JsonNode root = Jsons.mapper().readTree(LEGACY);

        Assertions.assertEquals("1.0", StateMigrator.detectVersion(root));
        QueueState state = migrator.migrate(root);

        Assertions.assertEquals(QueueState.CURRENT_VERSION, state.version());
        Assertions.assertEquals(List.of("main", "aux", "default"), List.copyOf(state.sources().keySet()));
        Assertions.assertEquals(List.of("main", "aux", "default"), state.coordinator().sourceOrder());
        Assertions.assertNull(state.coordinator().currentSource());

        SourceState main = state.sources().get("main");
        Assertions.assertTrue(main.path().endsWith("main"));
        Assertions.assertEquals(2, main.queue().size());
        Assertions.assertEquals(2L, main.statistics().totalQueued());
        Assertions.assertEquals(1L, main.statistics().totalCompleted());
        Assertions.assertEquals(1L, main.statistics().totalFailed());

        TaskRecord first = main.queue().get(0);
        Assertions.assertEquals(TaskStatus.COMPLETED, first.status());
        Assertions.assertEquals(TaskOrigin.WATCH, first.origin());
        Assertions.assertEquals("abc", first.contentFingerprint());
        Assertions.assertEquals(12L, first.fileSize());
        Assertions.assertEquals(Instant.parse("2025-01-01T10:00:00Z"), first.addedAt());
        Assertions.assertEquals(Instant.parse("2025-01-01T08:05:00Z"), first.completedAt());
        Assertions.assertEquals("boom", main.queue().get(1).error());

        SourceState aux = state.sources().get("aux");
        TaskRecord running = aux.queue().get(0);
        Assertions.assertEquals(TaskStatus.RUNNING, running.status());
        Assertions.assertNull(running.addedAt());
        Assertions.assertTrue(aux.processing().active());
        Assertions.assertEquals("task-20250101-110000-b", aux.processing().taskId());
        Assertions.assertEquals(321L, aux.processing().pid());
        Assertions.assertFalse(main.processing().active());

        SourceState fallback = state.sources().get(StateMigrator.DEFAULT_SOURCE_ID);
        Assertions.assertTrue(fallback.path().endsWith("loose"));
        Assertions.assertEquals(TaskStatus.PENDING, fallback.queue().get(0).status());

        Assertions.assertEquals(9L, state.globalStatistics().totalQueued());
        Assertions.assertEquals(4L, state.globalStatistics().totalCompleted());
        Assertions.assertEquals(2L, state.globalStatistics().totalFailed());
    }

    @Test
    void versionlessDocumentWithRootQueueIsLegacy() throws Exception {
        JsonNode root = Jsons.mapper().readTree("{\"queue\": []}");
        Assertions.assertEquals(StateMigrator.LEGACY_VERSION, StateMigrator.detectVersion(root));

        QueueState state = new StateMigrator(ZoneOffset.UTC).migrate(root);
        Assertions.assertTrue(state.sources().isEmpty());
        Assertions.assertEquals(QueueState.CURRENT_VERSION, state.version());
    }

    @Test
    void currentDocumentSurvivesSerialization() throws Exception {
        QueueState original = QueueState.empty();
        SourceState source = new SourceState("main", "/work/main");
        source.queue().add(new TaskRecord(
                "task-20250101-100000-a",
                "/work/main/pending/task-20250101-100000-a.md",
                "main",
                TaskOrigin.MANUAL,
                "hash",
                4L,
                Instant.parse("2025-01-01T10:00:00Z")
        ));
        original.sources().put("main", source);
        original.coordinator().sourceOrder().add("main");
        original.coordinator().moveTo("main", Instant.parse("2025-01-01T10:01:00Z"));

        JsonNode tree = Jsons.mapper().readTree(Jsons.toJson(original));
        Assertions.assertEquals("2.0", StateMigrator.detectVersion(tree));
        QueueState restored = new StateMigrator(ZoneOffset.UTC).migrate(tree);

        TaskRecord record = restored.sources().get("main").queue().get(0);
        Assertions.assertEquals("task-20250101-100000-a", record.id());
        Assertions.assertEquals(TaskOrigin.MANUAL, record.origin());
        Assertions.assertEquals("hash", record.contentFingerprint());
        Assertions.assertEquals("main", restored.coordinator().currentSource());
        Assertions.assertEquals(Instant.parse("2025-01-01T10:01:00Z"), restored.coordinator().lastSwitch());
    }

    @Test
    void unknownVersionAndBadShapesAreRejected() throws Exception {
        StateMigrator migrator = new StateMigrator(ZoneOffset.UTC);

        QueueStateException unsupported = Assertions.assertThrows(
                QueueStateException.class,
                () -> migrator.migrate(Jsons.mapper().readTree("{\"version\": \"9.9\"}"))
        );
        Assertions.assertTrue(unsupported.getMessage().contains("9.9"));
        Assertions.assertThrows(QueueStateException.class, () -> migrator.migrate(Jsons.mapper().readTree("[1, 2]")));
        Assertions.assertThrows(
                QueueStateException.class,
                () -> migrator.migrate(Jsons.mapper().readTree("{\"version\": \"2.0\", \"sources\": {\"main\": {\"id\": \"main\", \"queue\": [{\"id\": \"x\", \"status\": \"exploded\"}]}}}"))
        );
    }

    @Test
    void timestampsAcceptUtcOffsetAndLocalForms() {
        StateMigrator migrator = new StateMigrator(ZoneOffset.ofHours(1));

        Assertions.assertEquals(Instant.parse("2025-03-01T12:00:00Z"), migrator.parseTimestamp("2025-03-01T12:00:00Z"));
        Assertions.assertEquals(Instant.parse("2025-03-01T10:00:00Z"), migrator.parseTimestamp("2025-03-01T12:00:00+02:00"));
        Assertions.assertEquals(Instant.parse("2025-03-01T11:00:00Z"), migrator.parseTimestamp("2025-03-01T12:00:00"));
        Assertions.assertEquals(Instant.parse("2025-03-01T11:00:00.123456Z"), migrator.parseTimestamp("2025-03-01T12:00:00.123456"));
        Assertions.assertNull(migrator.parseTimestamp("yesterday"));
        Assertions.assertNull(migrator.parseTimestamp(" "));
    }
}
