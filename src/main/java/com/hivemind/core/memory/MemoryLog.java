package com.hivemind.core.memory;

import com.hivemind.core.model.MemoryEntry;

import java.util.List;

/**
 * Durable backing for the memory store: replayed once at startup, appended to afterwards.
 */
public interface MemoryLog {

    /**
     * Returns every entry ever appended, in any order.
     *
     * @throws com.hivemind.core.persistence.StorageException if the medium cannot be read
     */
    List<MemoryEntry> readAll();

    /**
     * Durably appends one entry.
     *
     * @throws com.hivemind.core.persistence.StorageException if the write fails
     */
    void append(MemoryEntry entry);

    /** Human-readable location for logs and health output. */
    String describe();
}
