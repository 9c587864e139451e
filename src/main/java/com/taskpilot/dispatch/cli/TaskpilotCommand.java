package com.taskpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Taskpilot.
 * Routes to subcommands: autopilot, deps.
 */
@Command(
        name = "taskpilot",
        mixinStandardHelpOptions = true,
        version = "Taskpilot 0.1.0",
        description = "TDD workflow orchestration and task dependency checks",
        subcommands = {
                AutopilotCommand.class,
                DepsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskpilotCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
