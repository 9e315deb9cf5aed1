package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public final class TaskRecord {
    @JsonProperty("id")
    @JsonAlias("task_id")
    private String id;
    @JsonProperty("specPath")
    @JsonAlias({"spec_file", "task_doc_file"})
    private String specPath;
    @JsonProperty("sourceId")
    @JsonAlias({"spec_dir_id", "task_doc_dir_id"})
    private String sourceId;
    @JsonProperty("status")
    private TaskStatus status = TaskStatus.PENDING;
    @JsonProperty("origin")
    @JsonAlias("source")
    private TaskOrigin origin = TaskOrigin.LOAD;
    @JsonProperty("attempts")
    private int attempts;
    @JsonProperty("contentFingerprint")
    @JsonAlias("file_hash")
    private String contentFingerprint;
    @JsonProperty("fileSize")
    @JsonAlias("file_size")
    private long fileSize;
    @JsonProperty("addedAt")
    @JsonAlias("added_at")
    private Instant addedAt;
    @JsonProperty("startedAt")
    @JsonAlias("started_at")
    private Instant startedAt;
    @JsonProperty("completedAt")
    @JsonAlias("completed_at")
    private Instant completedAt;
    @JsonProperty("error")
    private String error;

    private TaskRecord() {
    }

    public TaskRecord(
            String id,
            String specPath,
            String sourceId,
            TaskOrigin origin,
            String contentFingerprint,
            long fileSize,
            Instant addedAt
    ) {
        this.id = id;
        this.specPath = specPath;
        this.sourceId = sourceId;
        this.origin = origin == null ? TaskOrigin.LOAD : origin;
        this.contentFingerprint = contentFingerprint;
        this.fileSize = fileSize;
        this.addedAt = addedAt;
    }

    public String id() {
        return id;
    }

    public String specPath() {
        return specPath;
    }

    public String sourceId() {
        return sourceId;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskOrigin origin() {
        return origin;
    }

    public int attempts() {
        return attempts;
    }

    public String contentFingerprint() {
        return contentFingerprint;
    }

    public long fileSize() {
        return fileSize;
    }

    public Instant addedAt() {
        return addedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String error() {
        return error;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == TaskStatus.RUNNING;
    }

    public void updateFile(String specPath, String contentFingerprint, long fileSize) {
        this.specPath = specPath;
        this.contentFingerprint = contentFingerprint;
        this.fileSize = fileSize;
    }

    public void markRunning(Instant now) {
        this.status = TaskStatus.RUNNING;
        this.startedAt = now;
        this.completedAt = null;
        this.error = null;
        this.attempts++;
    }

    public void markCompleted(Instant now) {
        this.status = TaskStatus.COMPLETED;
        this.completedAt = now;
        this.error = null;
    }

    public void markFailed(Instant now, String error) {
        this.status = TaskStatus.FAILED;
        this.completedAt = now;
        this.error = error;
    }

    public void requeue(TaskOrigin origin) {
        this.status = TaskStatus.PENDING;
        this.startedAt = null;
        this.completedAt = null;
        this.error = null;
        this.origin = origin == null ? this.origin : origin;
    }

    public void release(String reason) {
        this.status = TaskStatus.PENDING;
        this.startedAt = null;
        this.completedAt = null;
        this.error = reason;
    }

    void normalize() {
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        if (origin == null) {
            origin = TaskOrigin.LOAD;
        }
        attempts = Math.max(0, attempts);
    }
}
