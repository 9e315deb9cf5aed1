package io.specqueue.scan;

import io.specqueue.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class DirectoryScanner {
    public static final List<String> DEFAULT_PATTERNS = List.of("task-*.md");

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final boolean fingerprintEnabled;
    private final List<PathMatcher> matchers;

    public DirectoryScanner(boolean fingerprintEnabled) {
        this(fingerprintEnabled, DEFAULT_PATTERNS);
    }

    public DirectoryScanner(boolean fingerprintEnabled, List<String> patterns) {
        this.fingerprintEnabled = fingerprintEnabled;
        List<String> effective = patterns == null || patterns.isEmpty() ? DEFAULT_PATTERNS : patterns;
        List<PathMatcher> compiled = new ArrayList<>();
        for (String pattern : effective) {
            compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        this.matchers = List.copyOf(compiled);
    }

    public boolean fingerprintEnabled() {
        return fingerprintEnabled;
    }

    public List<DiscoveredTask> scan(String sourceId, Path pendingDir) {
        List<DiscoveredTask> discovered = new ArrayList<>();
        if (!Files.isDirectory(pendingDir)) {
            return discovered;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pendingDir)) {
            for (Path entry : stream) {
                describe(sourceId, entry).ifPresent(discovered::add);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list pending directory: " + pendingDir, e);
        }
        discovered.sort(Comparator.comparing(task -> task.specFile().getFileName().toString()));
        return discovered;
    }

    public Optional<DiscoveredTask> describe(String sourceId, Path file) {
        if (!matches(file)) {
            return Optional.empty();
        }
        String taskId = TaskIds.fromPath(file);
        if (!TaskIds.isValid(taskId)) {
            return Optional.empty();
        }
        try {
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            long size = Files.size(file);
            String fingerprint = fingerprintEnabled && size > 0L ? Hashing.md5Hex(file) : null;
            return Optional.of(new DiscoveredTask(taskId, file.toAbsolutePath().normalize(), sourceId, fingerprint, size, Instant.now()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Skipping unreadable task file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean matches(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    public boolean isModified(Path file, String knownFingerprint) {
        if (!fingerprintEnabled) {
            return false;
        }
        if (knownFingerprint == null) {
            return true;
        }
        try {
            return !knownFingerprint.equals(Hashing.md5Hex(file));
        } catch (IOException e) {
            return true;
        }
    }

    public boolean isModified(DiscoveredTask task, String knownFingerprint) {
        if (!fingerprintEnabled) {
            return false;
        }
        if (knownFingerprint == null) {
            return task.fingerprint() != null;
        }
        return !knownFingerprint.equals(task.fingerprint());
    }
}
