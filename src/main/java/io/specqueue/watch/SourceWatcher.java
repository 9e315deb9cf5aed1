package io.specqueue.watch;

import io.specqueue.scan.DirectoryScanner;
import io.specqueue.scan.TaskIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.TimeUnit;

public final class SourceWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SourceWatcher.class);
    private static final long POLL_SECONDS = 1L;

    private final String sourceId;
    private final Path pendingDir;
    private final DirectoryScanner scanner;
    private final DebounceSignal debounce;
    private final TaskFileListener listener;
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public SourceWatcher(
            String sourceId,
            Path pendingDir,
            DirectoryScanner scanner,
            DebounceSignal debounce,
            TaskFileListener listener
    ) {
        this.sourceId = sourceId;
        this.pendingDir = pendingDir;
        this.scanner = scanner;
        this.debounce = debounce;
        this.listener = listener;
    }

    public synchronized void start() throws IOException {
        if (thread != null) {
            log.warn("Watcher already running for source '{}'", sourceId);
            return;
        }
        if (!Files.isDirectory(pendingDir)) {
            throw new IOException("Pending directory does not exist: " + pendingDir);
        }
        watchService = FileSystems.getDefault().newWatchService();
        pendingDir.register(
                watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY
        );
        running = true;
        thread = new Thread(this::pollLoop, "spec-queue-watch-" + sourceId);
        thread.setDaemon(true);
        thread.start();
        log.info("Watching '{}': {}", sourceId, pendingDir);
    }

    public boolean isRunning() {
        Thread current = thread;
        return running && current != null && current.isAlive();
    }

    @Override
    public synchronized void close() {
        if (thread == null) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service for '{}': {}", sourceId, e.getMessage());
        }
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
        log.debug("Stopped watching '{}'", sourceId);
    }

    private void pollLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key == null) {
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch events overflowed for '{}', requesting rescan", sourceId);
                    listener.onOverflow(sourceId);
                    continue;
                }
                Object context = event.context();
                if (context instanceof Path) {
                    handle(pendingDir.resolve((Path) context), event.kind().name());
                }
            }
            if (!key.reset()) {
                log.warn("Watch key for '{}' is no longer valid; pending directory removed?", sourceId);
                running = false;
            }
        }
    }

    void handle(Path file, String kind) {
        if (!scanner.matches(file)) {
            return;
        }
        if (!debounce.notify(file.toString())) {
            log.debug("Debounced {} event for: {}", kind, file.getFileName());
            return;
        }
        if (!TaskIds.isValid(TaskIds.fromPath(file))) {
            log.debug("Ignoring file with invalid task id: {}", file.getFileName());
            return;
        }
        log.debug("Task file {}: {}", kind, file.getFileName());
        try {
            listener.onTaskFile(file, sourceId);
        } catch (RuntimeException e) {
            log.error("Failed to load {} for '{}'", file.getFileName(), sourceId, e);
        }
        debounce.cleanup(DebounceSignal.DEFAULT_MAX_AGE);
    }
}
