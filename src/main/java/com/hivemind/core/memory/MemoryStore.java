package com.hivemind.core.memory;

import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.MemoryQuery;
import com.hivemind.core.model.NewMemory;
import com.hivemind.core.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only store of {@link MemoryEntry} records with filtered, recency-ordered recall.
 * <p>
 * Appends take the write lock and reach the {@link MemoryLog} before they
 * become visible to queries, so a reader never sees an entry that was not
 * durably written. Queries share the read lock and run concurrently.
 */
@Service
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    /** Newest first; equal timestamps keep insertion order. */
    static final Comparator<MemoryEntry> RECENCY = Comparator
            .comparing(MemoryEntry::timestamp).reversed()
            .thenComparingLong(MemoryEntry::sequence);

    private final MemoryLog memoryLog;
    private final HivemindMetrics metrics;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<MemoryEntry> entries = new ArrayList<>();
    private long nextSequence;
    private volatile boolean healthy = true;

    public MemoryStore(MemoryLog memoryLog, HivemindMetrics metrics, Clock clock) {
        this.memoryLog = memoryLog;
        this.metrics = metrics;
        this.clock = clock;
        replay();
    }

    private void replay() {
        try {
            var loaded = new ArrayList<>(memoryLog.readAll());
            loaded.sort(Comparator.comparingLong(MemoryEntry::sequence));
            entries.addAll(loaded);
            nextSequence = loaded.isEmpty() ? 0 : loaded.get(loaded.size() - 1).sequence() + 1;
            log.info("Memory store ready with {} entries ({})", entries.size(), memoryLog.describe());
        } catch (StorageException e) {
            healthy = false;
            log.error("Memory log could not be replayed, starting empty: {}", e.getMessage(), e);
        }
    }

    /**
     * Assigns an id, sequence and timestamp, writes the entry durably and makes it visible.
     *
     * @return the stored entry
     * @throws StorageException if the backing log rejects the write; nothing becomes visible in that case
     */
    public MemoryEntry append(NewMemory memory) {
        lock.writeLock().lock();
        try {
            var entry = new MemoryEntry(
                    UUID.randomUUID().toString(),
                    nextSequence,
                    memory.agentId(),
                    memory.projectId(),
                    memory.type(),
                    memory.content(),
                    memory.tags(),
                    clock.instant(),
                    memory.taskId(),
                    memory.memoryTraceId(),
                    memory.status());
            try {
                memoryLog.append(entry);
            } catch (StorageException e) {
                healthy = false;
                throw e;
            }
            entries.add(entry);
            nextSequence++;
            healthy = true;
            metrics.recordMemoryAppend(entry.type());
            log.debug("Memory {} written for {} [{}]", entry.memoryId(), entry.agentId(), entry.type());
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns at most {@code query.limit()} matching entries, newest first.
     */
    public List<MemoryEntry> query(MemoryQuery query) {
        lock.readLock().lock();
        try {
            var stream = entries.stream()
                    .filter(query::matches)
                    .sorted(RECENCY);
            if (query.limit() > 0) {
                stream = stream.limit(query.limit());
            }
            return stream.toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<MemoryEntry> query(String agentId, String projectId, String type, int limit) {
        return query(MemoryQuery.of(agentId, projectId, type, limit));
    }

    public Optional<MemoryEntry> findById(String memoryId) {
        lock.readLock().lock();
        try {
            return entries.stream()
                    .filter(e -> e.memoryId().equals(memoryId))
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** False after a failed replay or append, until the next successful append. */
    public boolean isHealthy() {
        return healthy;
    }

    public String describe() {
        return memoryLog.describe();
    }
}
