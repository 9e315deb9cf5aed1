package io.specqueue.storage;

import java.nio.file.Path;
import java.time.Duration;

public final class LockTimeoutException extends RuntimeException {
    private final Path lockFile;

    public LockTimeoutException(Path lockFile, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for lock: " + lockFile);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
