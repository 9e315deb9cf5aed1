package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class QueueState {
    public static final String CURRENT_VERSION = "2.0";

    @JsonProperty("version")
    private String version = CURRENT_VERSION;
    @JsonProperty("sources")
    private LinkedHashMap<String, SourceState> sources = new LinkedHashMap<>();
    @JsonProperty("coordinator")
    private CoordinatorState coordinator = new CoordinatorState();
    @JsonProperty("globalStatistics")
    @JsonAlias("global_statistics")
    private QueueStatistics globalStatistics = new QueueStatistics();
    @JsonProperty("updatedAt")
    @JsonAlias("updated_at")
    private Instant updatedAt;

    public QueueState() {
    }

    public static QueueState empty() {
        return new QueueState();
    }

    public String version() {
        return version;
    }

    public Map<String, SourceState> sources() {
        return sources;
    }

    public CoordinatorState coordinator() {
        return coordinator;
    }

    public QueueStatistics globalStatistics() {
        return globalStatistics;
    }

    public void globalStatistics(QueueStatistics statistics) {
        this.globalStatistics = statistics == null ? new QueueStatistics() : statistics;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    public int count(TaskStatus status) {
        int total = 0;
        for (SourceState source : sources.values()) {
            total += source.count(status);
        }
        return total;
    }

    // Jackson leaves fields absent from older documents null.
    public QueueState normalized() {
        if (version == null || version.isBlank()) {
            version = CURRENT_VERSION;
        }
        if (sources == null) {
            sources = new LinkedHashMap<>();
        }
        if (coordinator == null) {
            coordinator = new CoordinatorState();
        }
        if (globalStatistics == null) {
            globalStatistics = new QueueStatistics();
        }
        sources.values().removeIf(source -> source == null || source.id() == null);
        for (SourceState source : sources.values()) {
            source.normalize();
        }
        coordinator.normalize();
        return this;
    }
}
