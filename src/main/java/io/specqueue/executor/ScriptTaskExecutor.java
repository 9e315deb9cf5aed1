package io.specqueue.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class ScriptTaskExecutor implements TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(ScriptTaskExecutor.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    private final List<String> command;
    private final long timeoutMs;

    // timeoutMs <= 0 runs without a time limit.
    public ScriptTaskExecutor(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("executor command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String id() {
        return "script";
    }

    public List<String> command() {
        return command;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        if (request.workingDirectory() != null) {
            pb.directory(request.workingDirectory().toFile());
        }
        pb.environment().put("TASK_ID", request.taskId());
        pb.environment().put("SOURCE_ID", request.sourceId());
        pb.environment().put("TASK_SPEC_PATH", String.valueOf(request.specPath()));
        pb.environment().put("TASK_ATTEMPT", Integer.toString(request.attempt()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ExecutionResult.fail("executor spawn failed: " + e.getMessage());
        }
        log.debug("[{}] spawned pid={} command={}", request.taskId(), process.pid(), command);

        OutputCollector collector = new OutputCollector(process.getInputStream());
        Thread reader = new Thread(collector, "spec-queue-exec-" + request.taskId());
        reader.setDaemon(true);
        reader.start();
        // A child that never drains stdin must not hold the caller past the timeout.
        Thread writer = new Thread(() -> writePayload(process, request), "spec-queue-stdin-" + request.taskId());
        writer.setDaemon(true);
        writer.start();
        try {
            boolean finished;
            if (timeoutMs > 0L) {
                finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            } else {
                process.waitFor();
                finished = true;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ExecutionResult.fail("executor timeout after " + Duration.ofMillis(timeoutMs));
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));
            String combined = collector.text();
            if (process.exitValue() == 0) {
                return ExecutionResult.ok(limit(combined.strip(), MAX_OUTPUT_CHARS));
            }
            return new ExecutionResult(
                    false,
                    limit(combined.strip(), MAX_OUTPUT_CHARS),
                    "executor exit=" + process.exitValue() + " output=" + truncate(combined),
                    null,
                    null
            );
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static void writePayload(Process process, ExecutionRequest request) {
        try (OutputStream stdin = process.getOutputStream()) {
            byte[] input = request.payload() == null
                    ? new byte[0]
                    : request.payload().getBytes(StandardCharsets.UTF_8);
            stdin.write(input);
        } catch (IOException e) {
            // The command may exit without reading its input; its exit code decides.
            log.debug("[{}] stdin closed early: {}", request.taskId(), e.getMessage());
        }
    }

    private static String limit(String raw, int max) {
        if (raw.length() <= max) {
            return raw;
        }
        return raw.substring(0, max) + "...";
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        return limit(normalized, MAX_ERROR_CHARS);
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        private OutputCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                log.debug("executor output stream closed: {}", e.getMessage());
            }
        }

        private String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
