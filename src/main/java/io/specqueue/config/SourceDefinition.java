package io.specqueue.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Paths;
import java.time.Instant;

public final class SourceDefinition {
    @JsonProperty("id")
    private String id;
    @JsonProperty("path")
    private String path;
    @JsonProperty("description")
    private String description = "";
    @JsonProperty("addedAt")
    private Instant addedAt;

    private SourceDefinition() {
    }

    public SourceDefinition(String id, String path, String description, Instant addedAt) {
        this.id = id;
        this.path = path;
        this.description = description == null ? "" : description;
        this.addedAt = addedAt;
    }

    public String id() {
        return id;
    }

    public String path() {
        return path;
    }

    public String description() {
        return description;
    }

    public Instant addedAt() {
        return addedAt;
    }

    @JsonIgnore
    public SourceLayout layout() {
        return SourceLayout.of(Paths.get(path));
    }
}
