package com.hivemind.core.persistence;

import com.hivemind.core.memory.MemoryLog;
import com.hivemind.core.registry.AgentRegistryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring {@link Configuration} that chooses the backing medium for the agent
 * table and the memory log.
 * <p>
 * With {@code hivemind.storage.persistent=true} (the default) both live as
 * human-readable files under {@code hivemind.storage.directory}. Otherwise
 * in-memory stores are used, suitable for tests and dry runs but not durable
 * across restarts.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public MemoryLog memoryLog(StorageProperties properties) {
        if (properties.isPersistent()) {
            log.info("Memory log persisted to {}", properties.memoryFile().toAbsolutePath());
            return new JsonlMemoryLog(properties.memoryFile());
        }
        log.info("Persistence disabled; using in-memory memory log (entries will not survive restarts)");
        return new InMemoryMemoryLog();
    }

    @Bean
    public AgentRegistryStore agentRegistryStore(StorageProperties properties) {
        if (properties.isPersistent()) {
            log.info("Agent registry persisted to {}", properties.agentsFile().toAbsolutePath());
            return new JsonAgentRegistryStore(properties.agentsFile());
        }
        log.info("Persistence disabled; using in-memory agent registry store");
        return new InMemoryAgentRegistryStore();
    }
}
