package com.hivemind.dispatch.cli;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.registry.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: hivemind agents
 * <p>
 * Lists registered agents with their runtime state and loop count.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered agents")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<AgentRecord> agents = registry.list();
        ConsoleOutput.info("Agents (" + agents.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-12s %-6s %s%n", "AGENT ID", "STATE", "LOOPS", "DESCRIPTION");
        System.out.println("  " + "-".repeat(76));
        for (AgentRecord agent : agents) {
            System.out.printf("  %-14s %-12s %-6d %s%n", agent.agentId(), agent.agentState().wireName(),
                    agent.loopCount(), ConsoleOutput.truncate(agent.description(), 40));
        }
    }
}
