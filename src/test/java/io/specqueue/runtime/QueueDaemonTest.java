package io.specqueue.runtime;

import io.specqueue.config.ConfigStore;
import io.specqueue.config.SpecQueuePaths;
import io.specqueue.executor.ExecutionRequest;
import io.specqueue.executor.ExecutionResult;
import io.specqueue.executor.TaskExecutor;
import io.specqueue.model.TaskStatus;
import io.specqueue.model.TaskView;
import io.specqueue.observability.AuditLogger;
import io.specqueue.storage.ProcessIdentity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class QueueDaemonTest {

    @Test
    void workersDrainEverySourceAndPickUpWokenFiles() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-daemon-");
        try {
            Files.createDirectories(root.resolve("main"));
            Files.createDirectories(root.resolve("aux"));
            ConfigStore config = configure(root, false);
            config.updateSettings(Map.of("workerKeepaliveMs", 600_000));
            writeSpec(root, "main", "task-20250101-100000-m1", "main work");
            writeSpec(root, "aux", "task-20250101-100000-a1", "aux work");
            TaskProcessor processor = processor(root, config, new TaskExecutor() {
                @Override
                public String id() {
                    return "ok";
                }

                @Override
                public ExecutionResult execute(ExecutionRequest request) {
                    return ExecutionResult.ok(request.taskId());
                }
            });

            try (QueueDaemon daemon = new QueueDaemon(processor)) {
                daemon.start();
                Assertions.assertTrue(daemon.isRunning());
                Assertions.assertTrue(waitFor(() -> processor.status().completed() == 2, 10_000L));

                Path late = writeSpec(root, "main", "task-20250101-110000-m2", "arrived later");
                daemon.onTaskFile(late, "main");
                Assertions.assertTrue(waitFor(() -> processor.status().completed() == 3, 10_000L));
                Assertions.assertEquals("watch", processor.tasks("main", null).get(1).origin().wireName());
            }
            Assertions.assertTrue(processor.stopRequested());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void keepaliveRescanFindsFilesWithoutEvents() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-daemon-rescan-");
        try {
            Files.createDirectories(root.resolve("main"));
            Files.createDirectories(root.resolve("aux"));
            ConfigStore config = configure(root, false);
            TaskProcessor processor = processor(root, config, new TaskExecutor() {
                @Override
                public String id() {
                    return "ok";
                }

                @Override
                public ExecutionResult execute(ExecutionRequest request) {
                    return ExecutionResult.ok("ok");
                }
            });

            try (QueueDaemon daemon = new QueueDaemon(processor)) {
                daemon.start();
                writeSpec(root, "aux", "task-20250101-120000-a1", "dropped silently");
                Assertions.assertTrue(waitFor(() -> processor.status().completed() == 1, 10_000L));
                Assertions.assertEquals("reload", processor.tasks("aux", null).get(0).origin().wireName());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directoryWatcherTriggersProcessing() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-daemon-watch-");
        try {
            Files.createDirectories(root.resolve("main"));
            Files.createDirectories(root.resolve("aux"));
            ConfigStore config = configure(root, true);
            config.updateSettings(Map.of("workerKeepaliveMs", 600_000));
            TaskProcessor processor = processor(root, config, new TaskExecutor() {
                @Override
                public String id() {
                    return "ok";
                }

                @Override
                public ExecutionResult execute(ExecutionRequest request) {
                    return ExecutionResult.ok("ok");
                }
            });

            try (QueueDaemon daemon = new QueueDaemon(processor)) {
                daemon.start();
                writeSpec(root, "main", "task-20250101-130000-w1", "watched");
                // Polling watch services can take several seconds to notice a file.
                Assertions.assertTrue(waitFor(() -> processor.status().completed() == 1, 30_000L));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopInterruptsBusyWorkerAndReturnsTaskToPending() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-daemon-stop-");
        try {
            Files.createDirectories(root.resolve("main"));
            Files.createDirectories(root.resolve("aux"));
            ConfigStore config = configure(root, false);
            writeSpec(root, "main", "task-20250101-140000-slow", "takes forever");
            CountDownLatch started = new CountDownLatch(1);
            TaskProcessor processor = processor(root, config, new TaskExecutor() {
                @Override
                public String id() {
                    return "slow";
                }

                @Override
                public ExecutionResult execute(ExecutionRequest request) throws InterruptedException {
                    started.countDown();
                    Thread.sleep(60_000L);
                    return ExecutionResult.ok("finished");
                }
            });

            QueueDaemon daemon = new QueueDaemon(processor);
            daemon.start();
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            daemon.stop();
            daemon.awaitTermination();

            Assertions.assertFalse(daemon.isRunning());
            TaskView task = processor.tasks("main", null).get(0);
            Assertions.assertEquals(TaskStatus.PENDING, task.status());
            Assertions.assertTrue(task.error().startsWith("Cancelled"));
            Assertions.assertTrue(Files.exists(root.resolve("main").resolve("pending").resolve("task-20250101-140000-slow.md")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static ConfigStore configure(Path root, boolean watch) {
        ConfigStore store = new ConfigStore(root.resolve("config.json"));
        store.addSource("main", root.resolve("main").toString(), null);
        store.addSource("aux", root.resolve("aux").toString(), null);
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("watchEnabled", watch);
        settings.put("watchDebounceMs", 50);
        settings.put("workerKeepaliveMs", 200);
        settings.put("workerRetryDelayMs", 100);
        settings.put("shutdownGraceMs", 200);
        settings.put("processLockTimeoutMs", 200);
        settings.put("lockPollIntervalMs", 10);
        store.updateSettings(settings);
        return store;
    }

    private static TaskProcessor processor(Path root, ConfigStore config, TaskExecutor executor) {
        SpecQueuePaths paths = new SpecQueuePaths(root.resolve("state"));
        return new TaskProcessor(
                config.validated(),
                paths,
                executor,
                new AuditLogger(paths.auditFile()),
                pid -> true,
                new ProcessIdentity(ProcessHandle.current().pid(), "test-host"),
                Clock.systemUTC()
        );
    }

    private static Path writeSpec(Path root, String sourceId, String taskId, String content) throws IOException {
        Path file = root.resolve(sourceId).resolve("pending").resolve(taskId + ".md");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static boolean waitFor(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20L);
        }
        return condition.getAsBoolean();
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
