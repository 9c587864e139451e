package com.taskpilot.dispatch.cli;

import com.taskpilot.core.config.TaskpilotProperties;
import com.taskpilot.core.dependency.CrossGroupDependencyConflictException;
import com.taskpilot.core.dependency.DependencyGraphValidator;
import com.taskpilot.core.dependency.DependencyIssue;
import com.taskpilot.core.dependency.MoveOptions;
import com.taskpilot.core.dependency.MoveValidationResult;
import com.taskpilot.core.task.TaskNotFoundException;
import com.taskpilot.core.task.TaskRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command group: taskpilot deps &lt;validate|move-check&gt;
 */
@Command(
        name = "deps",
        mixinStandardHelpOptions = true,
        description = "Check task dependencies",
        subcommands = {
                DepsCommand.Validate.class,
                DepsCommand.MoveCheck.class
        }
)
@Component
public class DepsCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "validate", mixinStandardHelpOptions = true,
            description = "Report self, missing and circular dependencies in a group")
    @Component
    static class Validate implements Callable<Integer> {

        @Option(names = {"--tag", "-t"}, description = "Task group (default: configured default group)")
        String tag;

        private final TaskRepository taskRepository;
        private final DependencyGraphValidator validator;
        private final TaskpilotProperties properties;

        Validate(TaskRepository taskRepository, DependencyGraphValidator validator, TaskpilotProperties properties) {
            this.taskRepository = taskRepository;
            this.validator = validator;
            this.properties = properties;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                String group = tag != null ? tag : properties.getTasks().getDefaultGroup();
                var tasks = taskRepository.listTasks(group);
                var result = validator.validateTaskDependencies(tasks);
                if (result.valid()) {
                    ConsoleOutput.success("No dependency issues in '" + group + "' (" + tasks.size() + " tasks)");
                    return CommandSupport.OK;
                }
                ConsoleOutput.error(result.issues().size() + " dependency issue(s) in '" + group + "':");
                for (DependencyIssue issue : result.issues()) {
                    System.out.printf("  %-9s %s%n", issue.type(), issue.message());
                }
                return CommandSupport.FAILED;
            });
        }
    }

    @Command(name = "move-check", mixinStandardHelpOptions = true,
            description = "Check whether a task can move to another group")
    @Component
    static class MoveCheck implements Callable<Integer> {

        @Parameters(index = "0", description = "Task ID")
        String taskId;

        @Option(names = "--from", required = true, description = "Source group")
        String from;

        @Option(names = "--to", required = true, description = "Target group")
        String to;

        @Option(names = "--with-dependencies", description = "Bring dependencies along")
        boolean withDependencies;

        @Option(names = "--ignore-dependencies", description = "Sever conflicting dependencies")
        boolean ignoreDependencies;

        private final TaskRepository taskRepository;
        private final DependencyGraphValidator validator;

        MoveCheck(TaskRepository taskRepository, DependencyGraphValidator validator) {
            this.taskRepository = taskRepository;
            this.validator = validator;
        }

        @Override
        public Integer call() {
            return CommandSupport.guard(() -> {
                var task = taskRepository.findTask(taskId, from)
                        .orElseThrow(() -> new TaskNotFoundException(taskId, from));
                try {
                    MoveValidationResult result = validator.validateCrossTagMove(task, from, to,
                            taskRepository.listAllTasks(),
                            new MoveOptions(withDependencies, ignoreDependencies));
                    ConsoleOutput.success("Task " + taskId + " can move from '" + from + "' to '" + to + "'"
                            + " (resolution: " + result.resolution() + ")");
                    result.conflicts().forEach(ConsoleOutput::conflict);
                    if (result.tasksToMove().size() > 1) {
                        ConsoleOutput.info("Tasks to move: " + String.join(", ", result.tasksToMove()));
                    }
                    return CommandSupport.OK;
                } catch (CrossGroupDependencyConflictException e) {
                    ConsoleOutput.error("Task " + taskId + " cannot move to '" + to + "' without a resolution:");
                    e.report().conflicts().forEach(ConsoleOutput::conflict);
                    System.out.println();
                    e.report().suggestions().forEach(s -> ConsoleOutput.info(s));
                    return CommandSupport.FAILED;
                }
            });
        }
    }
}
