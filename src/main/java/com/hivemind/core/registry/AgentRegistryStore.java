package com.hivemind.core.registry;

import com.hivemind.core.model.AgentRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of agents.
 */
public interface AgentRegistryStore {

    /**
     * @return the persisted agents, or empty when nothing has been persisted yet
     * @throws com.hivemind.core.persistence.StorageException if persisted data exists but cannot be read
     */
    Optional<List<AgentRecord>> load();

    /**
     * Replaces the persisted table with {@code agents}.
     *
     * @throws com.hivemind.core.persistence.StorageException if the write fails
     */
    void save(Collection<AgentRecord> agents);

    /**
     * True when the persisted table was rewritten by someone else (another
     * process sharing the file) since this store last loaded or saved it.
     *
     * @throws com.hivemind.core.persistence.StorageException if the backing file cannot be inspected
     */
    default boolean changedExternally() {
        return false;
    }

    String describe();
}
