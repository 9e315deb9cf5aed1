package io.specqueue.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.specqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Crash-safe persistence of single JSON documents.
 *
 * <p>Writes go to a hidden temporary sibling that is synced and then renamed over
 * the target, so readers only ever see the previous document or the new one.
 * Reads never fail on a missing or unparsable file.
 */
public final class AtomicStateStore {
    private static final Logger log = LoggerFactory.getLogger(AtomicStateStore.class);

    private final ObjectMapper mapper;

    public AtomicStateStore() {
        this(Jsons.mapper());
    }

    public AtomicStateStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(Path path, Object document) throws IOException {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
        try {
            try (FileOutputStream out = new FileOutputStream(temp.toFile())) {
                mapper.writer()
                        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                        .writeValue(out, document);
                out.flush();
                out.getFD().sync();
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        syncDirectory(dir);
    }

    public <T> T read(Path path, Class<T> type, T defaultValue) {
        if (!Files.isRegularFile(path)) {
            return defaultValue;
        }
        try {
            T value = mapper.readValue(path.toFile(), type);
            return value == null ? defaultValue : value;
        } catch (NoSuchFileException e) {
            return defaultValue;
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON document {}: {}", path, e.getMessage());
            return defaultValue;
        }
    }

    public Optional<JsonNode> readTree(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(path.toFile());
            if (node == null || node.isMissingNode() || node.isNull()) {
                log.warn("Ignoring empty JSON document {}", path);
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON document {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static void syncDirectory(Path dir) {
        // Not every platform allows opening a directory for sync.
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Directory sync skipped for {}: {}", dir, e.getMessage());
        }
    }
}
