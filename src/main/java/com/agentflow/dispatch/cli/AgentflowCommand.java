package com.agentflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Agentflow.
 * Routes to subcommands: run, validate.
 */
@Command(
        name = "agentflow",
        mixinStandardHelpOptions = true,
        version = "Agentflow 0.1.0",
        description = "Runs multi-agent workflows as dependency-ordered waves of tasks",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentflowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
