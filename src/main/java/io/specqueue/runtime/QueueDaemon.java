package io.specqueue.runtime;

import io.specqueue.config.QueueSettings;
import io.specqueue.config.SourceLayout;
import io.specqueue.model.TaskOrigin;
import io.specqueue.watch.DebounceSignal;
import io.specqueue.watch.SourceWatcher;
import io.specqueue.watch.TaskFileListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-running mode: one worker thread and one directory watcher per source.
 *
 * <p>A worker drains its own source through {@link TaskProcessor#processTasks}, then sleeps on
 * the source's {@link DebounceSignal} until the watcher reports a file or the keepalive
 * elapses, after which it rescans the source. Sources therefore run in parallel while each
 * source stays sequential.
 */
public final class QueueDaemon implements TaskFileListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueDaemon.class);
    private static final Duration FINAL_JOIN = Duration.ofSeconds(5);

    private final TaskProcessor processor;
    private final QueueSettings settings;
    private final Map<String, DebounceSignal> signals = new LinkedHashMap<>();
    private final Map<String, SourceWatcher> watchers = new LinkedHashMap<>();
    private final Map<String, Thread> workers = new LinkedHashMap<>();
    private volatile boolean started;
    private volatile boolean stopped;

    public QueueDaemon(TaskProcessor processor) {
        this.processor = processor;
        this.settings = processor.settings();
        for (String sourceId : processor.sourceIds()) {
            signals.put(sourceId, new DebounceSignal(settings.watchDebounce()));
        }
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        List<String> sourceIds = processor.sourceIds();
        log.info("Queue daemon starting with {} source(s): {}", sourceIds.size(), sourceIds);
        try {
            processor.loadTasks(TaskOrigin.LOAD);
        } catch (RuntimeException e) {
            log.warn("Initial load failed, workers will rescan: {}", e.getMessage());
        }
        if (settings.watchEnabled()) {
            for (String sourceId : sourceIds) {
                startWatcher(sourceId);
            }
        } else {
            log.info("Directory watching disabled; sources are rescanned every {} ms", settings.workerKeepaliveMs());
        }
        for (String sourceId : sourceIds) {
            Thread worker = new Thread(() -> workerLoop(sourceId), "spec-queue-worker-" + sourceId);
            workers.put(sourceId, worker);
            worker.start();
        }
    }

    public void installShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "spec-queue-shutdown"));
    }

    public void awaitTermination() throws InterruptedException {
        for (Thread worker : workerThreads()) {
            worker.join();
        }
    }

    public boolean isRunning() {
        return started && !stopped;
    }

    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        log.info("Queue daemon shutting down");
        processor.requestStop();
        for (DebounceSignal signal : signals.values()) {
            signal.signal();
        }
        for (SourceWatcher watcher : watcherList()) {
            watcher.close();
        }
        List<Thread> threads = workerThreads();
        long deadline = System.nanoTime() + Duration.ofMillis(settings.shutdownGraceMs()).toNanos();
        try {
            for (Thread worker : threads) {
                long remainingMs = Math.max(0L, (deadline - System.nanoTime()) / 1_000_000L);
                if (remainingMs > 0L) {
                    worker.join(remainingMs);
                }
            }
            for (Thread worker : threads) {
                if (worker.isAlive()) {
                    log.warn("Worker {} still busy after {} ms, interrupting", worker.getName(), settings.shutdownGraceMs());
                    worker.interrupt();
                }
            }
            for (Thread worker : threads) {
                worker.join(FINAL_JOIN.toMillis());
                if (worker.isAlive()) {
                    log.warn("Worker {} did not stop", worker.getName());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Queue daemon stopped");
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public void onTaskFile(Path specFile, String sourceId) {
        try {
            processor.loadSingleTask(specFile, sourceId, TaskOrigin.WATCH);
        } catch (RuntimeException e) {
            log.warn("[{}] could not load {} from watch event, keepalive rescan will retry: {}",
                    sourceId, specFile.getFileName(), e.getMessage());
        }
        wake(sourceId);
    }

    @Override
    public void onOverflow(String sourceId) {
        try {
            processor.loadTasks(List.of(sourceId), TaskOrigin.WATCH);
        } catch (RuntimeException e) {
            log.warn("[{}] rescan after watch overflow failed: {}", sourceId, e.getMessage());
        }
        wake(sourceId);
    }

    public void wake(String sourceId) {
        DebounceSignal signal = signals.get(sourceId);
        if (signal != null) {
            signal.signal();
        }
    }

    private void startWatcher(String sourceId) {
        SourceLayout layout = processor.layout(sourceId).orElseThrow();
        try {
            Files.createDirectories(layout.pending());
            SourceWatcher watcher = new SourceWatcher(sourceId, layout.pending(), processor.scanner(), signals.get(sourceId), this);
            watcher.start();
            synchronized (watchers) {
                watchers.put(sourceId, watcher);
            }
            log.info("[{}] watching {}", sourceId, layout.pending());
        } catch (IOException e) {
            log.error("[{}] failed to watch {}, relying on keepalive rescans", sourceId, layout.pending(), e);
        }
    }

    private void workerLoop(String sourceId) {
        DebounceSignal signal = signals.get(sourceId);
        Duration keepalive = Duration.ofMillis(settings.workerKeepaliveMs());
        Duration retryDelay = Duration.ofMillis(settings.workerRetryDelayMs());
        log.info("[{}] worker started", sourceId);
        try {
            while (!stopped && !processor.stopRequested()) {
                try {
                    signal.clear();
                    TaskProcessor.ProcessOutcome outcome = processor.processTasks(
                            TaskProcessor.ProcessRequest.forSource(sourceId, settings.batchSize()));
                    if (stopped || Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    if (outcome.status() == TaskProcessor.ProcessStatus.SKIPPED) {
                        signal.await(retryDelay);
                    } else if (!outcome.dispatched().isEmpty()) {
                        continue;
                    } else if (outcome.remaining() > 0) {
                        // Pending work held by another process.
                        signal.await(retryDelay);
                    } else if (!signal.await(keepalive) && !stopped) {
                        processor.loadTasks(List.of(sourceId), TaskOrigin.RELOAD);
                    }
                } catch (RuntimeException e) {
                    log.error("[{}] error in worker loop, retrying in {} ms", sourceId, retryDelay.toMillis(), e);
                    signal.await(retryDelay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[{}] worker stopped", sourceId);
    }

    private List<Thread> workerThreads() {
        synchronized (this) {
            return new ArrayList<>(workers.values());
        }
    }

    private List<SourceWatcher> watcherList() {
        synchronized (watchers) {
            return new ArrayList<>(watchers.values());
        }
    }
}
