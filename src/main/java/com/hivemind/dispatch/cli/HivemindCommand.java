package com.hivemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Hivemind.
 * Routes to subcommands: serve, agents, memory, caps, reset, health.
 */
@Command(
        name = "hivemind",
        mixinStandardHelpOptions = true,
        version = "Hivemind 0.1.0",
        description = "Multi-agent orchestration core with capped loops and delegation",
        subcommands = {
                ServeCommand.class,
                AgentsCommand.class,
                MemoryCommand.class,
                CapsCommand.class,
                ResetCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HivemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
