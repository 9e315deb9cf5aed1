package io.specqueue.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specqueue.model.ProcessingMarker;
import io.specqueue.model.QueueState;
import io.specqueue.model.QueueStatistics;
import io.specqueue.model.SourceState;
import io.specqueue.model.TaskRecord;
import io.specqueue.model.TaskStatus;
import io.specqueue.storage.QueueStateException;
import io.specqueue.util.Jsons;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a parsed state document of any known version into a current {@link QueueState}.
 *
 * <p>Version "1.0" kept one global queue; its records are grouped by source id, in first-seen
 * order. Legacy snake_case names are accepted through the model's aliases and zone-less
 * timestamps are read in {@code zone}. No I/O.
 */
public final class StateMigrator {
    public static final String LEGACY_VERSION = "1.0";
    public static final String DEFAULT_SOURCE_ID = "default";

    private static final Set<String> TIMESTAMP_FIELDS = Set.of(
            "addedAt", "added_at",
            "startedAt", "started_at",
            "completedAt", "completed_at",
            "updatedAt", "updated_at",
            "lastSwitch", "last_switch",
            "lastProcessedAt", "last_processed_at",
            "lastLoadAt", "last_load_at"
    );

    private final ObjectMapper mapper;
    private final ZoneId zone;

    public StateMigrator() {
        this(ZoneId.systemDefault());
    }

    public StateMigrator(ZoneId zone) {
        this.mapper = Jsons.mapper();
        this.zone = zone;
    }

    public static String detectVersion(JsonNode root) {
        String version = root.path("version").asText("");
        if (!version.isBlank()) {
            return version;
        }
        return root.path("queue").isArray() ? LEGACY_VERSION : QueueState.CURRENT_VERSION;
    }

    public QueueState migrate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new QueueStateException("State document is not a JSON object", null);
        }
        ObjectNode copy = root.deepCopy();
        normalizeTimestamps(copy);
        String version = detectVersion(copy);
        try {
            if (LEGACY_VERSION.equals(version)) {
                return fromLegacy(copy);
            }
            if (QueueState.CURRENT_VERSION.equals(version)) {
                QueueState state = mapper.treeToValue(copy, QueueState.class);
                return state.normalized();
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new QueueStateException("State document does not match version " + version, e);
        }
        throw new QueueStateException("Unsupported state version: " + version, null);
    }

    private QueueState fromLegacy(ObjectNode root) throws JsonProcessingException {
        Map<String, List<TaskRecord>> grouped = new LinkedHashMap<>();
        for (JsonNode taskNode : root.path("queue")) {
            TaskRecord record = mapper.treeToValue(taskNode, TaskRecord.class);
            if (record == null || record.id() == null) {
                continue;
            }
            String sourceId = record.sourceId() == null || record.sourceId().isBlank()
                    ? DEFAULT_SOURCE_ID
                    : record.sourceId();
            grouped.computeIfAbsent(sourceId, ignored -> new ArrayList<>()).add(record);
        }

        QueueState state = QueueState.empty();
        for (Map.Entry<String, List<TaskRecord>> entry : grouped.entrySet()) {
            List<TaskRecord> records = entry.getValue();
            SourceState source = new SourceState(entry.getKey(), guessSourceRoot(records));
            source.queue().addAll(records);
            long completed = 0;
            long failed = 0;
            for (TaskRecord record : records) {
                if (record.status() == TaskStatus.COMPLETED) {
                    completed++;
                } else if (record.status() == TaskStatus.FAILED) {
                    failed++;
                }
            }
            source.statistics(new QueueStatistics(records.size(), completed, failed));
            state.sources().put(entry.getKey(), source);
            state.coordinator().sourceOrder().add(entry.getKey());
        }

        JsonNode statistics = root.path("statistics");
        if (statistics.isObject()) {
            state.globalStatistics(mapper.treeToValue(statistics, QueueStatistics.class));
        }
        JsonNode processing = root.path("processing");
        if (processing.isObject()) {
            ProcessingMarker marker = mapper.treeToValue(processing, ProcessingMarker.class);
            if (marker != null && marker.active() && marker.taskId() != null) {
                for (SourceState source : state.sources().values()) {
                    if (source.find(marker.taskId()).isPresent()) {
                        source.processing(marker);
                    }
                }
            }
        }
        return state.normalized();
    }

    private static String guessSourceRoot(List<TaskRecord> records) {
        for (TaskRecord record : records) {
            if (record.specPath() == null || record.specPath().isBlank()) {
                continue;
            }
            Path parent = Paths.get(record.specPath()).toAbsolutePath().getParent();
            if (parent == null) {
                continue;
            }
            if (parent.getFileName() != null && "pending".equals(parent.getFileName().toString()) && parent.getParent() != null) {
                return parent.getParent().toString();
            }
            return parent.toString();
        }
        return "";
    }

    private void normalizeTimestamps(JsonNode node) {
        if (node.isArray()) {
            for (JsonNode child : node) {
                normalizeTimestamps(child);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode object = (ObjectNode) node;
        List<String> names = new ArrayList<>();
        Iterator<String> it = object.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        for (String name : names) {
            JsonNode value = object.get(name);
            if (TIMESTAMP_FIELDS.contains(name) && value.isTextual()) {
                Instant parsed = parseTimestamp(value.asText());
                if (parsed == null) {
                    object.putNull(name);
                } else {
                    object.put(name, parsed.toString());
                }
            } else {
                normalizeTimestamps(value);
            }
        }
    }

    Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ignored) {
            // Not UTC "Z" form; try with an offset next.
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignored) {
            // Zone-less local time as written by older releases.
        }
        try {
            return LocalDateTime.parse(raw).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
