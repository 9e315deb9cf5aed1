package io.specqueue.config;

import java.util.List;

public final class ConfigValidationException extends IllegalArgumentException {
    private final List<String> problems;

    public ConfigValidationException(String message) {
        this(List.of(message));
    }

    public ConfigValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
