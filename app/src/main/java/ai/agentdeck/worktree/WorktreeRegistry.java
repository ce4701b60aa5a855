package ai.agentdeck.worktree;

import ai.agentdeck.util.AtomicWrites;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Durable list of session worktrees, persisted as JSON. Entries that fail validation or whose
 * directory no longer exists are dropped one by one when the file is loaded. Not thread-safe;
 * {@link WorktreeIsolator} serialises access.
 */
final class WorktreeRegistry {
    private static final Logger logger = LogManager.getLogger(WorktreeRegistry.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    record RegistryFile(List<WorktreeRecord> worktrees) {}

    private final Path file;
    private final Map<String, WorktreeRecord> records = new LinkedHashMap<>();

    WorktreeRegistry(Path file) {
        this.file = file;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            logger.warn("Ignoring unreadable worktree registry {}", file, e);
            return;
        }
        var entries = root == null ? null : root.get("worktrees");
        if (entries == null || !entries.isArray()) {
            return;
        }
        int dropped = 0;
        for (var entry : entries) {
            WorktreeRecord record;
            try {
                record = OBJECT_MAPPER.treeToValue(entry, WorktreeRecord.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Dropping invalid worktree registry entry {}", entry, e);
                dropped++;
                continue;
            }
            if (record != null && Files.isDirectory(Path.of(record.worktreePath()))) {
                records.put(record.sessionId(), record);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            logger.info("Dropped {} worktree registry entries that are invalid or whose directory is gone", dropped);
            save();
        }
    }

    List<WorktreeRecord> all() {
        return List.copyOf(records.values());
    }

    @Nullable
    WorktreeRecord get(String sessionId) {
        return records.get(sessionId);
    }

    void put(WorktreeRecord record) {
        records.put(record.sessionId(), record);
        save();
    }

    @Nullable
    WorktreeRecord remove(String sessionId) {
        var removed = records.remove(sessionId);
        if (removed != null) {
            save();
        }
        return removed;
    }

    private void save() {
        try {
            var json = OBJECT_MAPPER.writeValueAsString(new RegistryFile(new ArrayList<>(records.values())));
            AtomicWrites.atomicOverwrite(file, json);
        } catch (IOException e) {
            logger.error("Failed to save worktree registry {}", file, e);
        }
    }
}
