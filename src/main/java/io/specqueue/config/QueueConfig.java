package io.specqueue.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class QueueConfig {
    public static final String CURRENT_VERSION = "2.0";

    @JsonProperty("version")
    private String version = CURRENT_VERSION;
    @JsonProperty("projectWorkspace")
    private String projectWorkspace;
    @JsonProperty("sources")
    private List<SourceDefinition> sources = new ArrayList<>();
    @JsonProperty("settings")
    private QueueSettings settings = new QueueSettings();
    @JsonProperty("createdAt")
    private Instant createdAt;
    @JsonProperty("updatedAt")
    private Instant updatedAt;

    public QueueConfig() {
    }

    public static QueueConfig defaults(Instant now) {
        QueueConfig config = new QueueConfig();
        config.createdAt = now;
        config.updatedAt = now;
        return config;
    }

    public String version() {
        return version;
    }

    public String projectWorkspace() {
        return projectWorkspace;
    }

    public List<SourceDefinition> sources() {
        return List.copyOf(sources);
    }

    public QueueSettings settings() {
        return settings;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Optional<SourceDefinition> source(String sourceId) {
        for (SourceDefinition source : sources) {
            if (source.id().equals(sourceId)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    void projectWorkspace(String projectWorkspace) {
        this.projectWorkspace = projectWorkspace;
    }

    void settings(QueueSettings settings) {
        this.settings = settings;
    }

    void addSource(SourceDefinition source) {
        sources.add(source);
    }

    boolean removeSource(String sourceId) {
        return sources.removeIf(source -> source.id().equals(sourceId));
    }

    void touch(Instant now) {
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    QueueConfig normalized() {
        if (version == null || version.isBlank()) {
            version = CURRENT_VERSION;
        }
        if (sources == null) {
            sources = new ArrayList<>();
        }
        sources.removeIf(source -> source == null);
        if (settings == null) {
            settings = new QueueSettings();
        }
        return this;
    }
}
