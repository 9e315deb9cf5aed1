package io.specqueue.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

final class RunningMarkerTest {
    private static final String TASK = "task-20250101-120000-build";
    private static final ProcessIdentity SELF = new ProcessIdentity(4242L, "worker-host");

    @Test
    void claimWritesOwnerAndReleaseRemovesIt() throws Exception {
        Path pending = Files.createTempDirectory("spec-queue-marker-");
        try {
            AtomicStateStore store = new AtomicStateStore();
            RunningMarker marker = marker(pending, store, pid -> true);

            Assertions.assertEquals(RunningMarker.State.FREE, marker.inspect());
            Assertions.assertTrue(marker.claim("main", Duration.ZERO));

            RunningMarker.Owner owner = store.read(marker.markerFile(), RunningMarker.Owner.class, null);
            Assertions.assertNotNull(owner);
            Assertions.assertEquals(TASK, owner.taskId());
            Assertions.assertEquals("main", owner.sourceId());
            Assertions.assertEquals(4242L, owner.pid());
            Assertions.assertEquals("worker-host", owner.hostname());

            RunningMarker other = marker(pending, store, pid -> true);
            Assertions.assertEquals(RunningMarker.State.HELD, other.inspect());
            Assertions.assertFalse(other.claim("main", Duration.ZERO));

            marker.release();
            Assertions.assertFalse(Files.exists(marker.markerFile()));
            Assertions.assertEquals(RunningMarker.State.FREE, other.inspect());
        } finally {
            deleteRecursively(pending);
        }
    }

    @Test
    void markerOfDeadOwnerIsReclaimed() throws Exception {
        Path pending = Files.createTempDirectory("spec-queue-marker-dead-");
        try {
            AtomicStateStore store = new AtomicStateStore();
            Path markerFile = RunningMarker.markerPath(pending, TASK);
            store.write(markerFile, new RunningMarker.Owner(TASK, "main", 2_147_483_000L, "worker-host", Instant.now()));
            Files.writeString(RunningMarker.lockPath(pending, TASK), "2147483000:0:stale\n", StandardCharsets.UTF_8);

            RunningMarker marker = marker(pending, store, pid -> false);

            Assertions.assertEquals(RunningMarker.State.RECLAIMED, marker.inspect());
            Assertions.assertFalse(Files.exists(markerFile));
            Assertions.assertFalse(Files.exists(RunningMarker.lockPath(pending, TASK)));
            Assertions.assertEquals(RunningMarker.State.FREE, marker.inspect());
            Assertions.assertTrue(marker.claim("main", Duration.ZERO));
            marker.release();
        } finally {
            deleteRecursively(pending);
        }
    }

    @Test
    void liveOwnerOrForeignHostKeepsTheMarker() throws Exception {
        Path pending = Files.createTempDirectory("spec-queue-marker-live-");
        try {
            AtomicStateStore store = new AtomicStateStore();
            Path markerFile = RunningMarker.markerPath(pending, TASK);

            store.write(markerFile, new RunningMarker.Owner(TASK, "main", 77L, "worker-host", Instant.now()));
            Assertions.assertEquals(RunningMarker.State.HELD, marker(pending, store, pid -> pid == 77L).inspect());

            store.write(markerFile, new RunningMarker.Owner(TASK, "main", 77L, "other-host", Instant.now()));
            Assertions.assertEquals(RunningMarker.State.HELD, marker(pending, store, pid -> false).inspect());
            Assertions.assertTrue(Files.exists(markerFile));
        } finally {
            deleteRecursively(pending);
        }
    }

    @Test
    void unreadableMarkerWithoutLockHolderIsReclaimed() throws Exception {
        Path pending = Files.createTempDirectory("spec-queue-marker-corrupt-");
        try {
            AtomicStateStore store = new AtomicStateStore();
            Path markerFile = RunningMarker.markerPath(pending, TASK);
            Files.writeString(markerFile, "{not json", StandardCharsets.UTF_8);

            Assertions.assertEquals(RunningMarker.State.RECLAIMED, marker(pending, store, pid -> true).inspect());
            Assertions.assertFalse(Files.exists(markerFile));
        } finally {
            deleteRecursively(pending);
        }
    }

    private static RunningMarker marker(Path pending, AtomicStateStore store, ProcessLiveness liveness) {
        return new RunningMarker(pending, TASK, store, liveness, SELF, Duration.ofMillis(10));
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
