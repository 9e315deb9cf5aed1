package io.specqueue.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * Advisory exclusive lock keyed by a file path, shared between processes.
 *
 * <p>{@link #acquire(Duration)} polls a non-blocking {@link FileChannel#tryLock()} until
 * the timeout elapses and never throws on contention. Threads of one JVM first pass a
 * per-path guard, so only one channel per lock file is ever open in this process. A guard
 * lives only while some thread is attempting or holding its path.
 */
public final class InterprocessLock implements AutoCloseable {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private static final ConcurrentMap<Path, Guard> JVM_GUARDS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final Duration pollInterval;
    private final Runnable afterOpen;
    private Guard guard;
    private FileChannel channel;
    private FileLock fileLock;

    public InterprocessLock(Path lockFile) {
        this(lockFile, DEFAULT_POLL_INTERVAL);
    }

    public InterprocessLock(Path lockFile, Duration pollInterval) {
        this(lockFile, pollInterval, () -> {
        });
    }

    InterprocessLock(Path lockFile, Duration pollInterval, Runnable afterOpen) {
        this.lockFile = lockFile.toAbsolutePath().normalize();
        this.pollInterval = pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()
                ? DEFAULT_POLL_INTERVAL
                : pollInterval;
        this.afterOpen = afterOpen;
    }

    public Path lockFile() {
        return lockFile;
    }

    public synchronized boolean acquire(Duration timeout) {
        if (fileLock != null) {
            return true;
        }
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        while (true) {
            if (tryAcquireOnce()) {
                return true;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0L) {
                return false;
            }
            try {
                Thread.sleep(Math.max(1L, Math.min(pollInterval.toMillis(), remainingNanos / 1_000_000L)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public void acquireOrThrow(Duration timeout) {
        if (!acquire(timeout)) {
            throw new LockTimeoutException(lockFile, timeout);
        }
    }

    public synchronized boolean isHeldByThisInstance() {
        return fileLock != null;
    }

    public synchronized boolean isHeld() {
        if (fileLock != null) {
            return true;
        }
        if (!tryAcquireOnce()) {
            return true;
        }
        release();
        return false;
    }

    public synchronized void release() {
        if (fileLock == null) {
            return;
        }
        try {
            // Unlink while still holding, so late openers of this inode detect it and retry.
            Files.deleteIfExists(lockFile);
        } catch (IOException ignored) {
            // A lingering lock file is harmless; the next holder truncates it.
        }
        try {
            fileLock.release();
        } catch (IOException ignored) {
            // Closing the channel below releases the lock as well.
        }
        closeChannel(channel);
        fileLock = null;
        channel = null;
        leaveGuard(lockFile, guard);
        guard = null;
    }

    @Override
    public void close() {
        release();
    }

    static int activeGuards() {
        return JVM_GUARDS.size();
    }

    private boolean tryAcquireOnce() {
        Guard entered = enterGuard(lockFile);
        if (entered == null) {
            return false;
        }
        FileChannel opened = null;
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try {
                Files.createFile(lockFile);
            } catch (FileAlreadyExistsException ignored) {
                // Left by a crashed holder or currently locked; tryLock decides.
            }
            Object keyBefore = fileKey();
            if (keyBefore == null) {
                leaveGuard(lockFile, entered);
                return false;
            }
            try {
                opened = FileChannel.open(lockFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
            } catch (NoSuchFileException e) {
                leaveGuard(lockFile, entered);
                return false;
            }
            afterOpen.run();
            FileLock lock = opened.tryLock();
            if (lock == null) {
                closeChannel(opened);
                leaveGuard(lockFile, entered);
                return false;
            }
            Object keyAfter = fileKey();
            if (!keyBefore.equals(keyAfter)) {
                // The path was unlinked or replaced around the open; the lock may sit on a dead inode.
                lock.release();
                closeChannel(opened);
                leaveGuard(lockFile, entered);
                return false;
            }
            byte[] owner = ownerRecord().getBytes(StandardCharsets.UTF_8);
            opened.truncate(0L);
            opened.write(ByteBuffer.wrap(owner), 0L);
            opened.force(true);
            this.channel = opened;
            this.fileLock = lock;
            this.guard = entered;
            return true;
        } catch (OverlappingFileLockException e) {
            closeChannel(opened);
            leaveGuard(lockFile, entered);
            return false;
        } catch (IOException e) {
            closeChannel(opened);
            leaveGuard(lockFile, entered);
            throw new IllegalStateException("Failed to open lock file: " + lockFile, e);
        }
    }

    private Object fileKey() throws IOException {
        try {
            BasicFileAttributes attributes = Files.readAttributes(lockFile, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            return attributes.fileKey() != null ? attributes.fileKey() : attributes.creationTime();
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private static Guard enterGuard(Path path) {
        Guard entry = JVM_GUARDS.compute(path, (key, current) -> {
            Guard guard = current == null ? new Guard() : current;
            guard.users++;
            return guard;
        });
        if (entry.permit.tryAcquire()) {
            return entry;
        }
        dropUser(path, entry);
        return null;
    }

    private static void leaveGuard(Path path, Guard entry) {
        if (entry == null) {
            return;
        }
        entry.permit.release();
        dropUser(path, entry);
    }

    private static void dropUser(Path path, Guard entry) {
        JVM_GUARDS.compute(path, (key, current) -> {
            if (current != entry) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }

    private static String ownerRecord() {
        return ProcessHandle.current().pid() + ":" + System.currentTimeMillis() + ":" + UUID.randomUUID() + "\n";
    }

    private static void closeChannel(FileChannel toClose) {
        if (toClose == null) {
            return;
        }
        try {
            toClose.close();
        } catch (IOException ignored) {
            // Nothing left to release on a channel that fails to close.
        }
    }

    private static final class Guard {
        private final Semaphore permit = new Semaphore(1);
        private int users;
    }
}
