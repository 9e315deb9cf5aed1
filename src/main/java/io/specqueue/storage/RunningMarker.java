package io.specqueue.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-task "running" marker kept next to the specification file.
 *
 * <p>The marker file {@code .<task-id>.running} names the owning process; the lock file
 * {@code .<task-id>.lock} is held for as long as the task executes. A marker whose owner
 * process is gone is deleted on inspection and the task becomes available again.
 */
public final class RunningMarker {

    public enum State {
        FREE,
        HELD,
        RECLAIMED
    }

    public record Owner(String taskId, String sourceId, long pid, String hostname, Instant startedAt) {
    }

    private final String taskId;
    private final Path markerFile;
    private final InterprocessLock taskLock;
    private final AtomicStateStore store;
    private final ProcessLiveness liveness;
    private final ProcessIdentity self;

    public RunningMarker(
            Path pendingDir,
            String taskId,
            AtomicStateStore store,
            ProcessLiveness liveness,
            ProcessIdentity self,
            Duration pollInterval
    ) {
        this.taskId = taskId;
        this.markerFile = markerPath(pendingDir, taskId);
        this.taskLock = new InterprocessLock(lockPath(pendingDir, taskId), pollInterval);
        this.store = store;
        this.liveness = liveness;
        this.self = self;
    }

    public static Path markerPath(Path pendingDir, String taskId) {
        return pendingDir.resolve("." + taskId + ".running");
    }

    public static Path lockPath(Path pendingDir, String taskId) {
        return pendingDir.resolve("." + taskId + ".lock");
    }

    public Path markerFile() {
        return markerFile;
    }

    public State inspect() {
        Owner owner = store.read(markerFile, Owner.class, null);
        if (owner == null) {
            if (Files.exists(markerFile)) {
                // Unparsable marker: nobody can prove ownership, fall back to the lock itself.
                return taskLock.isHeld() ? State.HELD : reclaim();
            }
            return taskLock.isHeld() ? State.HELD : State.FREE;
        }
        if (!self.sameHost(owner.hostname())) {
            return State.HELD;
        }
        if (liveness.isAlive(owner.pid())) {
            return State.HELD;
        }
        return reclaim();
    }

    public boolean claim(String sourceId, Duration timeout) {
        if (!taskLock.acquire(timeout)) {
            return false;
        }
        Owner owner = new Owner(taskId, sourceId, self.pid(), self.hostname(), Instant.now());
        try {
            store.write(markerFile, owner);
            return true;
        } catch (IOException e) {
            taskLock.release();
            throw new IllegalStateException("Failed to write running marker: " + markerFile, e);
        }
    }

    public void release() {
        try {
            Files.deleteIfExists(markerFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete running marker: " + markerFile, e);
        } finally {
            taskLock.release();
        }
    }

    public void discard() {
        reclaim();
    }

    private State reclaim() {
        try {
            Files.deleteIfExists(markerFile);
            Files.deleteIfExists(taskLock.lockFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reclaim running marker: " + markerFile, e);
        }
        return State.RECLAIMED;
    }
}
