package com.hivemind.core.registry;

import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.AgentState;
import com.hivemind.core.model.NewMemory;
import com.hivemind.core.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Durable table of agent identities and their mutable runtime state.
 * <p>
 * Every mutation is written through to the {@link AgentRegistryStore} before
 * it returns; a failed write rolls the in-memory change back and surfaces a
 * {@link StorageException}. Callers that must read, check and update an agent
 * as one step (the loop cap gate) wrap the sequence in {@link #withAgentLock}.
 * <p>
 * On startup the persisted table is loaded. If it is absent or unreadable the
 * built-in agents from {@link CoreAgents} are seeded, and any built-in agent
 * missing from a readable table is restored with default metadata.
 * <p>
 * The CLI and a running server share one store. Before every read and write
 * the registry asks the store whether it was rewritten elsewhere and, if so,
 * reloads it, so an operator reset made from the CLI is not overwritten by
 * the server's stale copy on its next write.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    static final String AUDIT_PROJECT = "system";

    private final AgentRegistryStore store;
    private final MemoryStore memoryStore;
    private final Clock clock;

    private final ReentrantReadWriteLock tableLock = new ReentrantReadWriteLock();
    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();

    private volatile boolean recoveredFromDefaults;
    private volatile boolean persistHealthy = true;

    public AgentRegistry(AgentRegistryStore store, MemoryStore memoryStore, Clock clock) {
        this.store = store;
        this.memoryStore = memoryStore;
        this.clock = clock;
        load();
    }

    private void load() {
        Optional<List<AgentRecord>> persisted;
        try {
            persisted = store.load();
        } catch (StorageException e) {
            log.warn("Agent registry unreadable ({}), recovering with built-in agents: {}",
                    store.describe(), e.getMessage());
            recoveredFromDefaults = true;
            persisted = Optional.empty();
        }

        boolean dirty = persisted.isEmpty();
        persisted.ifPresent(records -> records.forEach(r -> agents.put(r.agentId(), r)));

        Instant now = clock.instant();
        for (String coreId : CoreAgents.ids()) {
            if (!agents.containsKey(coreId)) {
                if (persisted.isPresent()) {
                    log.warn("Core agent {} missing from registry; restoring default metadata", coreId);
                }
                agents.put(coreId, CoreAgents.defaultRecord(coreId, now));
                dirty = true;
            }
        }

        if (dirty) {
            try {
                persist();
            } catch (StorageException e) {
                // Keep serving from memory; health reports the registry as DOWN until a write succeeds
                log.error("Recovered agent registry could not be persisted: {}", e.getMessage());
            }
        }
        log.info("Agent registry ready with {} agents ({})", agents.size(), store.describe());
    }

    /**
     * Registers a new agent with {@code loop_count=0} and {@code agent_state=idle}.
     *
     * @throws AgentAlreadyExistsException if the id is taken; the existing record is untouched
     * @throws IllegalArgumentException    if the id is blank
     */
    public AgentRecord create(String agentId, String name, String description,
                              List<String> traits, Set<String> modules) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        AgentRecord created;
        tableLock.writeLock().lock();
        try {
            reloadIfChangedExternally();
            if (agents.containsKey(agentId)) {
                throw new AgentAlreadyExistsException(agentId);
            }
            Instant now = clock.instant();
            created = new AgentRecord(
                    agentId,
                    name == null || name.isBlank() ? agentId.toUpperCase() : name,
                    description == null ? "" : description,
                    traits,
                    modules == null || modules.isEmpty() ? CoreAgents.DEFAULT_MODULES : modules,
                    now, 0, AgentState.IDLE, now);
            agents.put(agentId, created);
            try {
                persist();
            } catch (StorageException e) {
                agents.remove(agentId);
                throw e;
            }
        } finally {
            tableLock.writeLock().unlock();
        }
        log.info("Agent {} registered", agentId);
        audit(agentId, "agent_created", "Agent " + agentId + " registered");
        return created;
    }

    public AgentRecord create(String agentId, String description, List<String> traits) {
        return create(agentId, null, description, traits, null);
    }

    public Optional<AgentRecord> get(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        reloadIfChangedExternally();
        tableLock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            tableLock.readLock().unlock();
        }
    }

    /**
     * @throws AgentNotFoundException if the agent is not registered
     */
    public AgentRecord require(String agentId) {
        return get(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    public boolean contains(String agentId) {
        return get(agentId).isPresent();
    }

    /** All agents in registration order. */
    public List<AgentRecord> list() {
        reloadIfChangedExternally();
        tableLock.readLock().lock();
        try {
            return List.copyOf(agents.values());
        } finally {
            tableLock.readLock().unlock();
        }
    }

    public AgentRecord updateState(String agentId, AgentState state, boolean touchLastActive) {
        Instant touchedAt = touchLastActive ? clock.instant() : null;
        return replace(agentId, r -> r.withState(state, touchedAt));
    }

    public AgentRecord updateState(String agentId, AgentState state) {
        return updateState(agentId, state, true);
    }

    /**
     * Marks the agent busy for an invocation and touches {@code last_active}.
     * A halted agent stays in {@link AgentState#SYSTEM_HALT}.
     */
    public AgentRecord markBusy(String agentId, AgentState busyState) {
        Instant now = clock.instant();
        return withAgentLock(agentId, () -> replace(agentId, r -> r.withState(
                r.agentState() == AgentState.SYSTEM_HALT ? AgentState.SYSTEM_HALT : busyState, now)));
    }

    /**
     * Returns the agent to idle after an invocation, unless a cap breach halted it meanwhile.
     */
    public AgentRecord releaseToIdle(String agentId) {
        return withAgentLock(agentId, () -> replace(agentId, r -> r.agentState() == AgentState.SYSTEM_HALT
                ? r : r.withState(AgentState.IDLE, null)));
    }

    /**
     * @return the agent's loop count after the increment
     */
    public int incrementLoopCount(String agentId) {
        return withAgentLock(agentId, () -> replace(agentId, r -> r.withLoopCount(r.loopCount() + 1)).loopCount());
    }

    /**
     * Operator action: zeroes the loop counter and returns the agent to idle,
     * including out of {@link AgentState#SYSTEM_HALT}.
     */
    public AgentRecord resetLoopCount(String agentId) {
        AgentRecord reset = withAgentLock(agentId,
                () -> replace(agentId, r -> r.withLoopCount(0).withState(AgentState.IDLE, clock.instant())));
        log.info("Loop counter reset for agent {}", agentId);
        audit(agentId, "loop_reset", "Loop counter reset for " + agentId + " by operator");
        return reset;
    }

    /**
     * Runs {@code action} while holding the agent's private lock. Two callers
     * for the same agent never overlap; different agents proceed in parallel.
     */
    public <T> T withAgentLock(String agentId, Supplier<T> action) {
        ReentrantLock lock = agentLocks.computeIfAbsent(agentId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        tableLock.readLock().lock();
        try {
            return agents.size();
        } finally {
            tableLock.readLock().unlock();
        }
    }

    /** True when the persisted table was unreadable at startup and built-ins were substituted. */
    public boolean isRecoveredFromDefaults() {
        return recoveredFromDefaults;
    }

    /** False while the most recent write to the store has failed. */
    public boolean isPersistHealthy() {
        return persistHealthy;
    }

    public String describe() {
        return store.describe();
    }

    private AgentRecord replace(String agentId, UnaryOperator<AgentRecord> change) {
        tableLock.writeLock().lock();
        try {
            reloadIfChangedExternally();
            AgentRecord current = agents.get(agentId);
            if (current == null) {
                throw new AgentNotFoundException(agentId);
            }
            AgentRecord updated = change.apply(current);
            agents.put(agentId, updated);
            try {
                persist();
            } catch (StorageException e) {
                agents.put(agentId, current);
                throw e;
            }
            return updated;
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    /**
     * Replaces the in-memory table with the store's when another process rewrote it.
     * Built-in agents missing from the reloaded table keep their current record.
     * Must not be called while holding the read lock.
     */
    private void reloadIfChangedExternally() {
        try {
            if (!store.changedExternally()) {
                return;
            }
        } catch (StorageException e) {
            log.warn("Agent registry {} could not be checked for outside changes: {}", store.describe(), e.getMessage());
            return;
        }
        tableLock.writeLock().lock();
        try {
            if (!store.changedExternally()) {
                return;
            }
            Optional<List<AgentRecord>> persisted = store.load();
            if (persisted.isEmpty()) {
                // Removed on disk; the next write recreates it from memory
                return;
            }
            Map<String, AgentRecord> reloaded = new LinkedHashMap<>();
            persisted.get().forEach(r -> reloaded.put(r.agentId(), r));
            for (String coreId : CoreAgents.ids()) {
                if (!reloaded.containsKey(coreId) && agents.containsKey(coreId)) {
                    reloaded.put(coreId, agents.get(coreId));
                }
            }
            agents.clear();
            agents.putAll(reloaded);
            log.info("Agent registry {} changed on disk; reloaded {} agents", store.describe(), agents.size());
        } catch (StorageException e) {
            log.warn("Agent registry {} changed on disk but could not be reloaded; keeping the in-memory table: {}",
                    store.describe(), e.getMessage());
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    private void persist() {
        try {
            store.save(List.copyOf(agents.values()));
            persistHealthy = true;
        } catch (StorageException e) {
            persistHealthy = false;
            log.error("Failed to persist agent registry: {}", e.getMessage(), e);
            throw e;
        }
    }

    private void audit(String agentId, String type, String content) {
        try {
            memoryStore.append(NewMemory.of(agentId, AUDIT_PROJECT, type, content).withTags(Set.of("registry")));
        } catch (StorageException e) {
            log.warn("Audit entry {} for agent {} not written: {}", type, agentId, e.getMessage());
        }
    }
}
