package com.hivemind.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.registry.AgentRegistryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Agent table stored as a pretty-printed JSON object keyed by agent id.
 * <p>
 * Saves go to a sibling temp file first and are then moved over the target,
 * so a crash mid-write leaves the previous table intact.
 * <p>
 * The file's identity, modification time and size are remembered after every
 * load and save; {@link #changedExternally()} compares them with the file on disk.
 * Each save moves a new file into place, so a rewrite by another process
 * always changes the identity even within one timestamp tick.
 */
public class JsonAgentRegistryStore implements AgentRegistryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonAgentRegistryStore.class);
    private static final TypeReference<LinkedHashMap<String, AgentRecord>> TABLE_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper = StorageMapper.create();
    private volatile FileStamp lastSeen;

    public JsonAgentRegistryStore(Path file) {
        this.file = file;
    }

    @Override
    public Optional<List<AgentRecord>> load() {
        // Taken before reading: a rewrite racing this load shows up as a change next time
        lastSeen = stamp();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Map<String, AgentRecord> table = mapper.readValue(file.toFile(), TABLE_TYPE);
            if (table == null) {
                throw new StorageException("Agent registry " + file + " is empty");
            }
            var records = new ArrayList<AgentRecord>();
            for (var entry : table.entrySet()) {
                AgentRecord record = entry.getValue();
                if (record == null || record.agentId() == null || !record.agentId().equals(entry.getKey())) {
                    throw new StorageException("Agent registry " + file + " has a malformed row for key " + entry.getKey());
                }
                records.add(record);
            }
            log.info("Loaded {} agents from {}", records.size(), file);
            return Optional.of(records);
        } catch (IOException e) {
            throw new StorageException("Failed to read agent registry " + file, e);
        }
    }

    @Override
    public void save(Collection<AgentRecord> agents) {
        var table = new LinkedHashMap<String, AgentRecord>();
        for (AgentRecord agent : agents) {
            table.put(agent.agentId(), agent);
        }
        try {
            Path target = file.toAbsolutePath();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), table);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            lastSeen = stamp();
        } catch (IOException e) {
            throw new StorageException("Failed to write agent registry " + file, e);
        }
    }

    @Override
    public boolean changedExternally() {
        return !Objects.equals(stamp(), lastSeen);
    }

    private FileStamp stamp() {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileStamp(attributes.fileKey(), attributes.lastModifiedTime(), attributes.size());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StorageException("Failed to inspect agent registry " + file, e);
        }
    }

    private record FileStamp(Object fileKey, FileTime modified, long size) {}

    @Override
    public String describe() {
        return "json:" + file;
    }
}
