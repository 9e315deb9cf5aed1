package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskOrigin {
    LOAD("load"),
    MANUAL("manual"),
    WATCH("watch"),
    RELOAD("reload");

    private final String wireName;

    TaskOrigin(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TaskOrigin fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOAD;
        }
        for (TaskOrigin value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        // Legacy provenance names.
        if ("watchdog".equalsIgnoreCase(raw)) {
            return WATCH;
        }
        if ("api".equalsIgnoreCase(raw)) {
            return MANUAL;
        }
        throw new IllegalArgumentException("Unknown task origin: " + raw);
    }
}
