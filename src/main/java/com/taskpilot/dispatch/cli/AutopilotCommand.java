package com.taskpilot.dispatch.cli;

import com.taskpilot.core.engine.WorkflowStateMachine;
import com.taskpilot.core.model.Coverage;
import com.taskpilot.core.model.TestPhase;
import com.taskpilot.core.model.TestResult;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command group: taskpilot autopilot &lt;start|resume|status|next|complete|commit|finalize|abort&gt;
 * <p>
 * Each subcommand makes one call into {@link WorkflowStateMachine} and prints the result.
 */
@Command(
        name = "autopilot",
        mixinStandardHelpOptions = true,
        description = "Drive a task through RED, GREEN and COMMIT for each subtask",
        subcommands = {
                AutopilotCommand.Start.class,
                AutopilotCommand.Resume.class,
                AutopilotCommand.Status.class,
                AutopilotCommand.Next.class,
                AutopilotCommand.Complete.class,
                AutopilotCommand.Commit.class,
                AutopilotCommand.Finalize.class,
                AutopilotCommand.Abort.class
        }
)
@Component
public class AutopilotCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "start", mixinStandardHelpOptions = true, description = "Start a workflow for a task")
    @Component
    static class Start implements Callable<Integer> {

        @Parameters(index = "0", description = "Task ID")
        String taskId;

        @Option(names = {"--tag", "-t"}, description = "Task group (default: configured default group)")
        String tag;

        @Option(names = {"--force", "-f"}, description = "Discard an existing workflow")
        boolean force;

        private final WorkflowStateMachine machine;

        Start(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                WorkflowStatus status = machine.startTask(taskId, tag, force);
                ConsoleOutput.success("Workflow started for task " + status.taskId() + " on branch " + status.branchName());
                ConsoleOutput.status(status);
                System.out.println();
                ConsoleOutput.nextAction(machine.getNextAction());
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume the workflow of this project")
    @Component
    static class Resume implements Callable<Integer> {

        private final WorkflowStateMachine machine;

        Resume(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                ConsoleOutput.status(machine.resume());
                System.out.println();
                ConsoleOutput.nextAction(machine.getNextAction());
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "status", mixinStandardHelpOptions = true, description = "Show workflow status")
    @Component
    static class Status implements Callable<Integer> {

        @Option(names = "--json", description = "Print JSON")
        boolean json;

        private final WorkflowStateMachine machine;

        Status(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                if (!machine.hasWorkflow()) {
                    ConsoleOutput.info("No active workflow. Start one with: taskpilot autopilot start <taskId>");
                    return CommandSupport.FAILED;
                }
                WorkflowStatus status = machine.getStatus();
                if (json) {
                    CommandSupport.printJson(status);
                } else {
                    ConsoleOutput.status(status);
                }
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "next", mixinStandardHelpOptions = true, description = "Show the recommended next action")
    @Component
    static class Next implements Callable<Integer> {

        @Option(names = "--json", description = "Print JSON")
        boolean json;

        private final WorkflowStateMachine machine;

        Next(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                var action = machine.getNextAction();
                if (json) {
                    CommandSupport.printJson(action);
                } else {
                    ConsoleOutput.nextAction(action);
                }
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "complete", mixinStandardHelpOptions = true,
            description = "Report test results for the current RED or GREEN phase")
    @Component
    static class Complete implements Callable<Integer> {

        @Option(names = "--phase", required = true, description = "RED, GREEN or REFACTOR")
        TestPhase phase;

        @Option(names = "--passed", defaultValue = "0", description = "Passing tests")
        int passed;

        @Option(names = "--failed", defaultValue = "0", description = "Failing tests")
        int failed;

        @Option(names = "--skipped", defaultValue = "0", description = "Skipped tests")
        int skipped;

        @Option(names = "--total", description = "Total tests (default: passed + failed + skipped)")
        Integer total;

        @Option(names = "--coverage", split = ",",
                description = "Coverage as line,branch,function,statement percentages")
        double[] coverage;

        private final WorkflowStateMachine machine;

        Complete(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                if (coverage != null && coverage.length != 4) {
                    throw new IllegalArgumentException("--coverage needs four values: line,branch,function,statement");
                }
                var result = new TestResult(
                        total != null ? total : passed + failed + skipped,
                        passed, failed, skipped, phase,
                        coverage == null ? null : new Coverage(coverage[0], coverage[1], coverage[2], coverage[3]));
                WorkflowStatus status = machine.completePhase(result);
                ConsoleOutput.success(phase + " phase accepted");
                ConsoleOutput.status(status);
                System.out.println();
                ConsoleOutput.nextAction(machine.getNextAction());
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "commit", mixinStandardHelpOptions = true,
            description = "Commit the current subtask and advance")
    @Component
    static class Commit implements Callable<Integer> {

        private final WorkflowStateMachine machine;

        Commit(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                WorkflowStatus status = machine.commit();
                ConsoleOutput.success("Changes committed");
                ConsoleOutput.status(status);
                System.out.println();
                ConsoleOutput.nextAction(machine.getNextAction());
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "finalize", mixinStandardHelpOptions = true,
            description = "Verify a clean tree and complete the workflow")
    @Component
    static class Finalize implements Callable<Integer> {

        private final WorkflowStateMachine machine;

        Finalize(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                WorkflowStatus status = machine.finalizeWorkflow();
                if (status.phase() == WorkflowPhase.COMPLETE) {
                    ConsoleOutput.success("Workflow complete for task " + status.taskId());
                }
                ConsoleOutput.status(status);
                return CommandSupport.OK;
            });
        }
    }

    @Command(name = "abort", mixinStandardHelpOptions = true,
            description = "Delete the workflow state (branch and commits are kept)")
    @Component
    static class Abort implements Callable<Integer> {

        private final WorkflowStateMachine machine;

        Abort(WorkflowStateMachine machine) {
            this.machine = machine;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                boolean existed = machine.hasWorkflow();
                machine.abort();
                ConsoleOutput.info(existed ? "Workflow aborted" : "No active workflow");
                return CommandSupport.OK;
            });
        }
    }
}
