package io.specqueue.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SpecQueuePaths {
    public static final String DEFAULT_STATE_DIR = ".spec-queue";
    public static final String STATE_FILE_NAME = "queue_state.json";
    public static final String STATE_LOCK_NAME = "queue_state.lock";

    private final Path stateDir;

    public SpecQueuePaths(Path stateDir) {
        this.stateDir = stateDir;
    }

    public static SpecQueuePaths resolve(String explicitStateDir, String projectWorkspace) {
        Path resolved;
        if (explicitStateDir != null && !explicitStateDir.isBlank()) {
            resolved = Paths.get(explicitStateDir);
        } else if (projectWorkspace != null && !projectWorkspace.isBlank()) {
            resolved = Paths.get(projectWorkspace).resolve(DEFAULT_STATE_DIR);
        } else {
            resolved = Paths.get(DEFAULT_STATE_DIR);
        }
        return new SpecQueuePaths(resolved.toAbsolutePath().normalize());
    }

    public static Path defaultConfigFile() {
        return Paths.get(System.getProperty("user.home"), ".config", "spec-queue", "config.json");
    }

    public Path stateDir() {
        return stateDir;
    }

    public Path stateFile() {
        return stateDir.resolve(STATE_FILE_NAME);
    }

    public Path stateLockFile() {
        return stateDir.resolve(STATE_LOCK_NAME);
    }

    public Path auditRoot() {
        return stateDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
