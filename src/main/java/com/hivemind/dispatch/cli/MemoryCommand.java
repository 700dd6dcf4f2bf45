package com.hivemind.dispatch.cli;

import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.MemoryQuery;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: hivemind memory &lt;agent-id&gt;
 * <p>
 * Shows an agent's most recent memory entries, newest first.
 */
@Command(name = "memory", mixinStandardHelpOptions = true, description = "Show recent memory for an agent")
@Component
public class MemoryCommand implements Runnable {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Option(names = {"--project", "-p"}, description = "Restrict to one project")
    private String projectId;

    @Option(names = {"--type", "-t"}, description = "Restrict to one memory type")
    private String type;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final MemoryStore memoryStore;

    public MemoryCommand(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<MemoryEntry> entries = memoryStore.query(new MemoryQuery(agentId, projectId, type, null, null, limit));
        if (entries.isEmpty()) {
            ConsoleOutput.info("No memories found for " + agentId + ".");
            return;
        }

        ConsoleOutput.info("Memories for " + agentId + " (" + entries.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-16s %-10s %s%n", "TIMESTAMP", "TYPE", "PROJECT", "CONTENT");
        System.out.println("  " + "-".repeat(90));
        for (MemoryEntry entry : entries) {
            System.out.printf("  %-24s %-16s %-10s %s%n", entry.timestamp(), entry.type(),
                    entry.projectId(), ConsoleOutput.truncate(entry.content(), 40));
        }
    }
}
