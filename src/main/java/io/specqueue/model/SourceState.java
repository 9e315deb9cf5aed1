package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SourceState {
    @JsonProperty("id")
    private String id;
    @JsonProperty("path")
    private String path;
    @JsonProperty("queue")
    private List<TaskRecord> queue = new ArrayList<>();
    @JsonProperty("processing")
    private ProcessingMarker processing = ProcessingMarker.idle();
    @JsonProperty("statistics")
    private QueueStatistics statistics = new QueueStatistics();
    @JsonProperty("updatedAt")
    @JsonAlias("updated_at")
    private Instant updatedAt;

    private SourceState() {
    }

    public SourceState(String id, String path) {
        this.id = id;
        this.path = path;
    }

    public String id() {
        return id;
    }

    public String path() {
        return path;
    }

    public void path(String path) {
        this.path = path;
    }

    public List<TaskRecord> queue() {
        return queue;
    }

    public ProcessingMarker processing() {
        return processing;
    }

    public void processing(ProcessingMarker processing) {
        this.processing = processing == null ? ProcessingMarker.idle() : processing;
    }

    public QueueStatistics statistics() {
        return statistics;
    }

    public void statistics(QueueStatistics statistics) {
        this.statistics = statistics == null ? new QueueStatistics() : statistics;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    public Optional<TaskRecord> find(String taskId) {
        for (TaskRecord record : queue) {
            if (record.id().equals(taskId)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public Optional<TaskRecord> nextPending() {
        for (TaskRecord record : queue) {
            if (record.isPending()) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public Optional<TaskRecord> running() {
        for (TaskRecord record : queue) {
            if (record.isRunning()) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public int count(TaskStatus status) {
        int count = 0;
        for (TaskRecord record : queue) {
            if (record.status() == status) {
                count++;
            }
        }
        return count;
    }

    void normalize() {
        if (queue == null) {
            queue = new ArrayList<>();
        }
        queue.removeIf(record -> record == null || record.id() == null);
        for (TaskRecord record : queue) {
            record.normalize();
        }
        if (processing == null) {
            processing = ProcessingMarker.idle();
        }
        if (statistics == null) {
            statistics = new QueueStatistics();
        }
    }

    public boolean hasPending() {
        return nextPending().isPresent();
    }
}
