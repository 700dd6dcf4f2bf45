package com.hivemind.dispatch.cli;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.registry.AgentNotFoundException;
import com.hivemind.core.registry.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: hivemind reset &lt;agent-id&gt;
 * <p>
 * Operator reset of an agent's loop counter. This is the only way out of system_halt.
 */
@Command(name = "reset", mixinStandardHelpOptions = true,
        description = "Reset an agent's loop counter and clear system_halt")
@Component
public class ResetCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    private final AgentRegistry registry;

    public ResetCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            AgentRecord agent = registry.resetLoopCount(agentId);
            ConsoleOutput.success("Loop counter reset for " + agent.agentId());
            ConsoleOutput.agentState(agent.agentId(), agent.agentState().wireName(), agent.loopCount());
            return 0;
        } catch (AgentNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
