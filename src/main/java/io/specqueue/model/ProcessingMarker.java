package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public final class ProcessingMarker {
    @JsonProperty("active")
    @JsonAlias("is_processing")
    private boolean active;
    @JsonProperty("taskId")
    @JsonAlias("current_task")
    private String taskId;
    @JsonProperty("pid")
    @JsonAlias("process_id")
    private Long pid;
    @JsonProperty("hostname")
    private String hostname;
    @JsonProperty("startedAt")
    @JsonAlias("started_at")
    private Instant startedAt;

    public ProcessingMarker() {
    }

    public static ProcessingMarker idle() {
        return new ProcessingMarker();
    }

    public static ProcessingMarker running(String taskId, long pid, String hostname, Instant startedAt) {
        ProcessingMarker marker = new ProcessingMarker();
        marker.active = true;
        marker.taskId = taskId;
        marker.pid = pid;
        marker.hostname = hostname;
        marker.startedAt = startedAt;
        return marker;
    }

    public boolean active() {
        return active;
    }

    public String taskId() {
        return taskId;
    }

    public Long pid() {
        return pid;
    }

    public String hostname() {
        return hostname;
    }

    public Instant startedAt() {
        return startedAt;
    }
}
