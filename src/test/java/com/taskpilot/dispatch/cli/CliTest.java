package com.taskpilot.dispatch.cli;

import com.taskpilot.core.config.TaskpilotProperties;
import com.taskpilot.core.dependency.DependencyGraphValidator;
import com.taskpilot.core.engine.InvalidTransitionException;
import com.taskpilot.core.engine.WorkflowStateMachine;
import com.taskpilot.core.model.NextAction;
import com.taskpilot.core.model.Progress;
import com.taskpilot.core.model.SubtaskInfo;
import com.taskpilot.core.model.SubtaskStatus;
import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.TestPhase;
import com.taskpilot.core.model.TestResult;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowStatus;
import com.taskpilot.core.model.Task;
import com.taskpilot.core.task.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Taskpilot CLI command structure.
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private WorkflowStateMachine machine;
    private TaskRepository taskRepository;

    private static final WorkflowStatus RED_STATUS = new WorkflowStatus("7", WorkflowPhase.SUBTASK_LOOP,
            TddPhase.RED, "task-7-add-login",
            new SubtaskInfo("1", "Add login form", SubtaskStatus.IN_PROGRESS, 0, 3),
            List.of(), new Progress(0, 2, 1, 0));

    private static final NextAction GENERATE_TEST = new NextAction("generate_test",
            "Generate failing test for current subtask",
            List.of("Write failing tests for subtask 1: \"Add login form\"."),
            WorkflowPhase.SUBTASK_LOOP, TddPhase.RED, "1", "Add login form");

    @BeforeEach
    void setUp() {
        machine = mock(WorkflowStateMachine.class);
        taskRepository = mock(TaskRepository.class);
    }

    private CommandLine.IFactory createFactory() {
        var validator = new DependencyGraphValidator();
        var properties = new TaskpilotProperties();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AutopilotCommand.Start.class) {
                    return (K) new AutopilotCommand.Start(machine);
                }
                if (cls == AutopilotCommand.Resume.class) {
                    return (K) new AutopilotCommand.Resume(machine);
                }
                if (cls == AutopilotCommand.Status.class) {
                    return (K) new AutopilotCommand.Status(machine);
                }
                if (cls == AutopilotCommand.Next.class) {
                    return (K) new AutopilotCommand.Next(machine);
                }
                if (cls == AutopilotCommand.Complete.class) {
                    return (K) new AutopilotCommand.Complete(machine);
                }
                if (cls == AutopilotCommand.Commit.class) {
                    return (K) new AutopilotCommand.Commit(machine);
                }
                if (cls == AutopilotCommand.Finalize.class) {
                    return (K) new AutopilotCommand.Finalize(machine);
                }
                if (cls == AutopilotCommand.Abort.class) {
                    return (K) new AutopilotCommand.Abort(machine);
                }
                if (cls == DepsCommand.Validate.class) {
                    return (K) new DepsCommand.Validate(taskRepository, validator, properties);
                }
                if (cls == DepsCommand.MoveCheck.class) {
                    return (K) new DepsCommand.MoveCheck(taskRepository, validator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TaskpilotCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the command groups")
        void help() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("autopilot"));
            assertTrue(result.output().contains("deps"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskpilot 0.1.0"));
        }

        @Test
        @DisplayName("autopilot --help lists every workflow step")
        void autopilotHelp() {
            String output = execute("autopilot", "--help").output();
            for (String sub : List.of("start", "resume", "status", "next", "complete", "commit", "finalize", "abort")) {
                assertTrue(output.contains(sub), "missing subcommand " + sub);
            }
        }
    }

    @Nested
    @DisplayName("autopilot")
    class AutopilotTests {

        @Test
        @DisplayName("start passes task, tag and force to the engine")
        void start() {
            when(machine.startTask("7", "feature", true)).thenReturn(RED_STATUS);
            when(machine.getNextAction()).thenReturn(GENERATE_TEST);

            CliResult result = execute("autopilot", "start", "7", "--tag", "feature", "--force");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("task-7-add-login"));
            assertTrue(result.output().contains("generate_test"));
        }

        @Test
        @DisplayName("workflow errors exit 1 with their suggestion")
        void workflowError() {
            when(machine.startTask("7", null, false)).thenThrow(new InvalidTransitionException(
                    "Workflow already exists for task 3 (phase SUBTASK_LOOP)", "Use --force"));

            CliResult result = execute("autopilot", "start", "7");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Workflow already exists for task 3"));
            assertTrue(result.output().contains("Use --force"));
        }

        @Test
        @DisplayName("complete builds the test result from options")
        void complete() {
            when(machine.completePhase(any())).thenReturn(RED_STATUS);
            when(machine.getNextAction()).thenReturn(GENERATE_TEST);

            CliResult result = execute("autopilot", "complete", "--phase", "GREEN", "--passed", "5",
                    "--skipped", "1", "--coverage", "80,70,90,85");

            assertEquals(0, result.exitCode());
            var captor = ArgumentCaptor.forClass(TestResult.class);
            verify(machine).completePhase(captor.capture());
            TestResult submitted = captor.getValue();
            assertEquals(TestPhase.GREEN, submitted.phase());
            assertEquals(6, submitted.total());
            assertEquals(0, submitted.failed());
            assertEquals(70.0, submitted.coverage().branch());
        }

        @Test
        @DisplayName("complete rejects a partial coverage list as a usage error")
        void completeBadCoverage() {
            CliResult result = execute("autopilot", "complete", "--phase", "GREEN", "--passed", "1",
                    "--coverage", "80,70");

            assertEquals(2, result.exitCode());
            verify(machine, never()).completePhase(any());
        }

        @Test
        @DisplayName("status without a workflow exits 1")
        void statusNone() {
            when(machine.hasWorkflow()).thenReturn(false);

            CliResult result = execute("autopilot", "status");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No active workflow"));
        }

        @Test
        @DisplayName("status --json prints the status document")
        void statusJson() {
            when(machine.hasWorkflow()).thenReturn(true);
            when(machine.getStatus()).thenReturn(RED_STATUS);

            CliResult result = execute("autopilot", "status", "--json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"branchName\" : \"task-7-add-login\""));
        }

        @Test
        @DisplayName("abort succeeds with or without a workflow")
        void abort() {
            when(machine.hasWorkflow()).thenReturn(false);

            CliResult result = execute("autopilot", "abort");

            assertEquals(0, result.exitCode());
            verify(machine).abort();
        }
    }

    @Nested
    @DisplayName("deps")
    class DepsTests {

        @Test
        @DisplayName("validate reports issues and exits 1")
        void validateIssues() {
            when(taskRepository.listTasks("master")).thenReturn(List.of(
                    Task.of("1", "master", "2"), Task.of("2", "master", "1")));

            CliResult result = execute("deps", "validate");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("circular dependency chain"));
        }

        @Test
        @DisplayName("validate passes a clean group")
        void validateClean() {
            when(taskRepository.listTasks("backlog")).thenReturn(List.of(Task.of("1", "backlog")));

            assertEquals(0, execute("deps", "validate", "--tag", "backlog").exitCode());
        }

        @Test
        @DisplayName("move-check without a resolution lists conflicts and remediations")
        void moveCheckConflict() {
            var tasks = List.of(Task.of("1", "backlog", "2"), Task.of("2", "backlog"));
            when(taskRepository.findTask("1", "backlog")).thenReturn(Optional.of(tasks.get(0)));
            when(taskRepository.listAllTasks()).thenReturn(tasks);

            CliResult result = execute("deps", "move-check", "1", "--from", "backlog", "--to", "sprint");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Task 1 depends on 2 (in backlog)"));
            assertTrue(result.output().contains("Move dependencies first, then move the main task"));
        }

        @Test
        @DisplayName("move-check with both flags is a usage error")
        void moveCheckBothFlags() {
            var tasks = List.of(Task.of("1", "backlog", "2"), Task.of("2", "backlog"));
            when(taskRepository.findTask("1", "backlog")).thenReturn(Optional.of(tasks.get(0)));
            when(taskRepository.listAllTasks()).thenReturn(tasks);

            CliResult result = execute("deps", "move-check", "1", "--from", "backlog", "--to", "sprint",
                    "--with-dependencies", "--ignore-dependencies");

            assertEquals(2, result.exitCode());
        }

        @Test
        @DisplayName("move-check for an unknown task exits 1")
        void moveCheckUnknown() {
            when(taskRepository.findTask("9", "backlog")).thenReturn(Optional.empty());

            CliResult result = execute("deps", "move-check", "9", "--from", "backlog", "--to", "sprint");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Task 9 not found in group 'backlog'"));
        }
    }
}
