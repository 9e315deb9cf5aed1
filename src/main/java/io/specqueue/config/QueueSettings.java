package io.specqueue.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class QueueSettings {
    public static final long DEFAULT_WATCH_DEBOUNCE_MS = 500L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_PROCESS_LOCK_TIMEOUT_MS = 500L;
    public static final long DEFAULT_LOCK_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_WORKER_KEEPALIVE_MS = 60_000L;
    public static final long DEFAULT_WORKER_RETRY_DELAY_MS = 10_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 15_000L;

    @JsonProperty("watchEnabled")
    private boolean watchEnabled = true;
    @JsonProperty("watchDebounceMs")
    private long watchDebounceMs = DEFAULT_WATCH_DEBOUNCE_MS;
    @JsonProperty("watchPatterns")
    private List<String> watchPatterns = new ArrayList<>(List.of("task-*.md"));
    @JsonProperty("maxAttempts")
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    @JsonProperty("enableFingerprint")
    private boolean enableFingerprint = true;
    @JsonProperty("batchSize")
    private int batchSize = DEFAULT_BATCH_SIZE;
    @JsonProperty("lockTimeoutMs")
    private long lockTimeoutMs = DEFAULT_LOCK_TIMEOUT_MS;
    @JsonProperty("processLockTimeoutMs")
    private long processLockTimeoutMs = DEFAULT_PROCESS_LOCK_TIMEOUT_MS;
    @JsonProperty("lockPollIntervalMs")
    private long lockPollIntervalMs = DEFAULT_LOCK_POLL_INTERVAL_MS;
    @JsonProperty("workerKeepaliveMs")
    private long workerKeepaliveMs = DEFAULT_WORKER_KEEPALIVE_MS;
    @JsonProperty("workerRetryDelayMs")
    private long workerRetryDelayMs = DEFAULT_WORKER_RETRY_DELAY_MS;
    @JsonProperty("shutdownGraceMs")
    private long shutdownGraceMs = DEFAULT_SHUTDOWN_GRACE_MS;
    @JsonProperty("executorCommand")
    private List<String> executorCommand = new ArrayList<>();
    @JsonProperty("executorTimeoutMs")
    private long executorTimeoutMs;

    public QueueSettings() {
    }

    public boolean watchEnabled() {
        return watchEnabled;
    }

    public long watchDebounceMs() {
        return watchDebounceMs;
    }

    public List<String> watchPatterns() {
        return watchPatterns == null || watchPatterns.isEmpty() ? List.of("task-*.md") : List.copyOf(watchPatterns);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean enableFingerprint() {
        return enableFingerprint;
    }

    public int batchSize() {
        return batchSize;
    }

    public long lockTimeoutMs() {
        return lockTimeoutMs;
    }

    public long processLockTimeoutMs() {
        return processLockTimeoutMs;
    }

    public long lockPollIntervalMs() {
        return lockPollIntervalMs;
    }

    public long workerKeepaliveMs() {
        return workerKeepaliveMs;
    }

    public long workerRetryDelayMs() {
        return workerRetryDelayMs;
    }

    public long shutdownGraceMs() {
        return shutdownGraceMs;
    }

    public List<String> executorCommand() {
        return executorCommand == null ? List.of() : List.copyOf(executorCommand);
    }

    public long executorTimeoutMs() {
        return executorTimeoutMs;
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    public Duration processLockTimeout() {
        return Duration.ofMillis(processLockTimeoutMs);
    }

    public Duration lockPollInterval() {
        return Duration.ofMillis(lockPollIntervalMs);
    }

    public Duration watchDebounce() {
        return Duration.ofMillis(watchDebounceMs);
    }

    List<String> problems() {
        List<String> problems = new ArrayList<>();
        positive(problems, "watchDebounceMs", watchDebounceMs);
        positive(problems, "maxAttempts", maxAttempts);
        positive(problems, "batchSize", batchSize);
        positive(problems, "lockTimeoutMs", lockTimeoutMs);
        positive(problems, "processLockTimeoutMs", processLockTimeoutMs);
        positive(problems, "lockPollIntervalMs", lockPollIntervalMs);
        positive(problems, "workerKeepaliveMs", workerKeepaliveMs);
        positive(problems, "workerRetryDelayMs", workerRetryDelayMs);
        positive(problems, "shutdownGraceMs", shutdownGraceMs);
        if (executorTimeoutMs < 0L) {
            problems.add("executorTimeoutMs must be >= 0");
        }
        if (watchPatterns != null) {
            for (String pattern : watchPatterns) {
                if (pattern == null || pattern.isBlank()) {
                    problems.add("watchPatterns cannot contain blank entries");
                }
            }
        }
        return problems;
    }

    private static void positive(List<String> problems, String name, long value) {
        if (value <= 0L) {
            problems.add(name + " must be > 0");
        }
    }
}
