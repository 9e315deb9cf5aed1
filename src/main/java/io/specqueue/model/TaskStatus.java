package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        // Older state files carried a separate cancelled status.
        if ("cancelled".equalsIgnoreCase(raw.trim())) {
            return FAILED;
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
