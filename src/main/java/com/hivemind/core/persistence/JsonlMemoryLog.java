package com.hivemind.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.memory.MemoryLog;
import com.hivemind.core.model.MemoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only memory log stored as JSON Lines, one entry per line.
 * <p>
 * Not thread-safe on its own; {@link com.hivemind.core.memory.MemoryStore}
 * serialises every append.
 */
public class JsonlMemoryLog implements MemoryLog {

    private static final Logger log = LoggerFactory.getLogger(JsonlMemoryLog.class);

    private final Path file;
    private final ObjectMapper mapper = StorageMapper.create();

    public JsonlMemoryLog(Path file) {
        this.file = file;
    }

    @Override
    public List<MemoryEntry> readAll() {
        if (!Files.exists(file)) {
            log.info("No memory log at {}; starting empty", file);
            return List.of();
        }
        var entries = new ArrayList<MemoryEntry>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                MemoryEntry entry;
                try {
                    entry = mapper.readValue(line, MemoryEntry.class);
                } catch (JsonProcessingException e) {
                    // A torn trailing line after a crash must not hide the rest of the log
                    log.warn("Skipping unreadable memory log line {} in {}: {}", lineNumber, file, e.getOriginalMessage());
                    continue;
                }
                String missing = missingField(entry);
                if (missing != null) {
                    log.warn("Skipping unreadable memory log line {} in {}: missing {}", lineNumber, file, missing);
                    continue;
                }
                entries.add(entry);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read memory log " + file, e);
        }
        log.info("Loaded {} memory entries from {}", entries.size(), file);
        return entries;
    }

    /** Recall filters and recency ordering dereference these fields. */
    private static String missingField(MemoryEntry entry) {
        if (entry.memoryId() == null) return "memory_id";
        if (entry.agentId() == null) return "agent_id";
        if (entry.type() == null) return "type";
        if (entry.timestamp() == null) return "timestamp";
        return null;
    }

    @Override
    public void append(MemoryEntry entry) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = mapper.writeValueAsString(entry) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.DSYNC);
        } catch (IOException e) {
            throw new StorageException("Failed to append memory " + entry.memoryId() + " to " + file, e);
        }
    }

    @Override
    public String describe() {
        return "jsonl:" + file;
    }
}
