package com.hivemind.core.persistence;

import com.hivemind.core.memory.MemoryLog;
import com.hivemind.core.model.MemoryEntry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Volatile memory log used when persistence is disabled. Contents are lost on restart.
 */
public class InMemoryMemoryLog implements MemoryLog {

    private final CopyOnWriteArrayList<MemoryEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public List<MemoryEntry> readAll() {
        return List.copyOf(entries);
    }

    @Override
    public void append(MemoryEntry entry) {
        entries.add(entry);
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
