package com.hivemind.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "hivemind.storage")
public class StorageProperties {

    static final String AGENTS_FILE = "agents.json";
    static final String MEMORY_FILE = "memory.jsonl";

    private boolean persistent = true;
    private String directory = "./data";

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public Path agentsFile() {
        return Path.of(directory).resolve(AGENTS_FILE);
    }

    public Path memoryFile() {
        return Path.of(directory).resolve(MEMORY_FILE);
    }
}
