package io.specqueue.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specqueue.storage.AtomicStateStore;
import io.specqueue.storage.InterprocessLock;
import io.specqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
    private static final Pattern SOURCE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,63}$");
    private static final Duration SAVE_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final Path configFile;
    private final AtomicStateStore store;
    private final Clock clock;
    private QueueConfig config;

    public ConfigStore(Path configFile) {
        this(configFile, new AtomicStateStore(), Clock.systemUTC());
    }

    public ConfigStore(Path configFile, AtomicStateStore store, Clock clock) {
        this.configFile = configFile.toAbsolutePath().normalize();
        this.store = store;
        this.clock = clock;
        this.config = load();
    }

    public Path configFile() {
        return configFile;
    }

    public Path lockFile() {
        String name = configFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return configFile.resolveSibling(base + ".lock");
    }

    public synchronized QueueConfig config() {
        return config;
    }

    public synchronized void reload() {
        this.config = load();
    }

    public synchronized QueueConfig validated() {
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        return config;
    }

    public static List<String> validate(QueueConfig candidate) {
        List<String> problems = new ArrayList<>();
        String workspace = candidate.projectWorkspace();
        if (workspace != null && !workspace.isBlank() && !Files.isDirectory(Paths.get(workspace))) {
            problems.add("Project workspace is not a directory: " + workspace);
        }
        Set<String> seen = new HashSet<>();
        for (SourceDefinition source : candidate.sources()) {
            if (source.id() == null || !SOURCE_ID.matcher(source.id()).matches()) {
                problems.add("Invalid source id: " + source.id());
            } else if (!seen.add(source.id())) {
                problems.add("Duplicate source id: " + source.id());
            }
            if (source.path() == null || source.path().isBlank()) {
                problems.add("Source path is empty: " + source.id());
            } else if (!Files.isDirectory(Paths.get(source.path()))) {
                problems.add("Source directory does not exist: " + source.path());
            }
        }
        problems.addAll(candidate.settings().problems());
        return problems;
    }

    public synchronized void setProjectWorkspace(String workspace) {
        Path path = Paths.get(workspace).toAbsolutePath().normalize();
        if (!Files.isDirectory(path)) {
            throw new ConfigValidationException("Project workspace is not a directory: " + path);
        }
        config.projectWorkspace(path.toString());
        save();
    }

    public synchronized SourceDefinition addSource(String sourceId, String path, String description) {
        if (sourceId == null || !SOURCE_ID.matcher(sourceId).matches()) {
            throw new ConfigValidationException("Invalid source id: " + sourceId);
        }
        if (config.source(sourceId).isPresent()) {
            throw new ConfigValidationException("Source id already exists: " + sourceId);
        }
        Path root = Paths.get(path).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new ConfigValidationException("Source directory does not exist: " + root);
        }
        SourceDefinition source = new SourceDefinition(sourceId, root.toString(), description, Instant.now(clock));
        try {
            Files.createDirectories(source.layout().pending());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create pending directory: " + source.layout().pending(), e);
        }
        config.addSource(source);
        save();
        return source;
    }

    public synchronized boolean removeSource(String sourceId) {
        boolean removed = config.removeSource(sourceId);
        if (removed) {
            save();
        }
        return removed;
    }

    public synchronized Optional<SourceDefinition> source(String sourceId) {
        return config.source(sourceId);
    }

    public synchronized QueueSettings updateSettings(Map<String, ?> changes) {
        ObjectMapper mapper = Jsons.mapper();
        ObjectNode current = mapper.valueToTree(config.settings());
        List<String> problems = new ArrayList<>();
        for (String key : changes.keySet()) {
            if (!current.has(key)) {
                problems.add("Unknown setting: " + key);
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        ObjectNode patch = mapper.valueToTree(changes);
        current.setAll(patch);
        QueueSettings updated;
        try {
            updated = mapper.treeToValue(current, QueueSettings.class);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Invalid setting value: " + e.getOriginalMessage());
        }
        problems.addAll(updated.problems());
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        config.settings(updated);
        save();
        return updated;
    }

    public synchronized void save() {
        config.touch(Instant.now(clock));
        try (InterprocessLock lock = new InterprocessLock(lockFile())) {
            lock.acquireOrThrow(SAVE_LOCK_TIMEOUT);
            store.write(configFile, config);
        } catch (IOException e) {
            throw new RuntimeException("Failed to save config: " + configFile, e);
        }
    }

    private QueueConfig load() {
        if (!Files.exists(configFile)) {
            return QueueConfig.defaults(Instant.now(clock));
        }
        Optional<JsonNode> tree = store.readTree(configFile);
        if (tree.isEmpty()) {
            return QueueConfig.defaults(Instant.now(clock));
        }
        try {
            QueueConfig loaded = Jsons.mapper().treeToValue(tree.get(), QueueConfig.class);
            return loaded == null ? QueueConfig.defaults(Instant.now(clock)) : loaded.normalized();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Invalid config file {}, using defaults: {}", configFile, e.getMessage());
            return QueueConfig.defaults(Instant.now(clock));
        }
    }
}
