package com.hivemind.dispatch.cli;

import com.hivemind.core.caps.CapsPolicy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hivemind caps
 */
@Command(name = "caps", mixinStandardHelpOptions = true, description = "Show the active system caps")
@Component
public class CapsCommand implements Runnable {

    private final CapsPolicy caps;

    public CapsCommand(CapsPolicy caps) {
        this.caps = caps;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("System caps:");
        System.out.println("  max_loops_per_task:   " + caps.maxLoopsPerTask());
        System.out.println("  max_delegation_depth: " + caps.maxDelegationDepth());
    }
}
