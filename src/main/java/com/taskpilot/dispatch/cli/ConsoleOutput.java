package com.taskpilot.dispatch.cli;

import com.taskpilot.core.dependency.DependencyConflict;
import com.taskpilot.core.exception.WorkflowException;
import com.taskpilot.core.model.NextAction;
import com.taskpilot.core.model.SubtaskInfo;
import com.taskpilot.core.model.WorkflowError;
import com.taskpilot.core.model.WorkflowStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Taskpilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints the error kind, message and suggestions verbatim.
     */
    public static void workflowError(WorkflowException e) {
        error("@|bold " + e.kind() + "|@ " + e.getMessage());
        for (String suggestion : e.suggestions()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(cyan) >|@ " + suggestion));
        }
    }

    public static void status(WorkflowStatus status) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold TASK " + status.taskId() + "|@"));
        String phase = status.tddPhase() == null
                ? status.phase().name()
                : status.phase() + " / " + tddColor(status.tddPhase().name());
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Phase:    " + phase));
        if (status.branchName() != null) {
            System.out.println("  Branch:   " + status.branchName());
        }
        SubtaskInfo subtask = status.currentSubtask();
        if (subtask != null) {
            System.out.printf("  Subtask:  %s %s (attempts %d%s)%n", subtask.id(), subtask.title(),
                    subtask.attempts(), subtask.maxAttempts() == null ? "" : "/" + subtask.maxAttempts());
        }
        var p = status.progress();
        System.out.printf("  Progress: %d/%d subtasks (%d%%)%n", p.completed(), p.total(), p.percentage());

        if (!status.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + status.errors().size() + "):");
            for (WorkflowError e : status.errors()) {
                System.out.println("    " + e.timestamp() + " [" + e.phase() + "] " + e.message());
            }
        }
    }

    public static void nextAction(NextAction action) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + action.action() + "]|@ " + action.description()));
        int i = 1;
        for (String step : action.nextSteps()) {
            System.out.println("  " + i++ + ". " + step);
        }
    }

    public static void conflict(DependencyConflict conflict) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) -|@ " + conflict.message()));
    }

    private static String tddColor(String tddPhase) {
        return switch (tddPhase) {
            case "RED" -> "@|fg(red),bold RED|@";
            case "GREEN" -> "@|fg(green),bold GREEN|@";
            default -> "@|fg(blue),bold " + tddPhase + "|@";
        };
    }
}
