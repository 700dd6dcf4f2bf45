package com.hivemind.core.persistence;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.registry.AgentRegistryStore;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Volatile agent table used when persistence is disabled.
 */
public class InMemoryAgentRegistryStore implements AgentRegistryStore {

    private volatile List<AgentRecord> snapshot;

    @Override
    public Optional<List<AgentRecord>> load() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public void save(Collection<AgentRecord> agents) {
        snapshot = List.copyOf(agents);
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
