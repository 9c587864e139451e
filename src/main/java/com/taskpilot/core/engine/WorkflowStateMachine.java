package com.taskpilot.core.engine;

import com.taskpilot.core.commit.CommitMessageGenerator;
import com.taskpilot.core.commit.CommitMessageOptions;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.events.WorkflowEvent;
import com.taskpilot.core.events.WorkflowEventType;
import com.taskpilot.core.exception.WorkflowException;
import com.taskpilot.core.git.CommitOptions;
import com.taskpilot.core.git.DirtyWorkingTreeException;
import com.taskpilot.core.git.GitStatusSummary;
import com.taskpilot.core.git.VersionControlAdapter;
import com.taskpilot.core.logging.MdcContext;
import com.taskpilot.core.metrics.WorkflowMetrics;
import com.taskpilot.core.model.NextAction;
import com.taskpilot.core.model.Subtask;
import com.taskpilot.core.model.SubtaskInfo;
import com.taskpilot.core.model.SubtaskStatus;
import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.TestPhase;
import com.taskpilot.core.model.TestResult;
import com.taskpilot.core.model.WorkflowContext;
import com.taskpilot.core.model.WorkflowError;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowState;
import com.taskpilot.core.model.WorkflowStatus;
import com.taskpilot.core.persistence.WorkflowStateStore;
import com.taskpilot.core.persistence.WorkflowStateStoreException;
import com.taskpilot.core.task.TaskNotFoundException;
import com.taskpilot.core.task.TaskRepository;
import com.taskpilot.core.validation.CoverageThresholdNotMetException;
import com.taskpilot.core.validation.PhaseValidationOptions;
import com.taskpilot.core.validation.TestResultValidator;
import com.taskpilot.core.validation.TestValidationException;
import com.taskpilot.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a single task through PREFLIGHT, BRANCH_SETUP, the RED/GREEN/COMMIT subtask loop,
 * FINALIZE and COMPLETE.
 * <p>
 * The persisted state file is the source of truth: every operation loads it, checks the
 * {@link TransitionTable}, and saves after each step. The machine never runs tests or writes
 * code; callers report test results through {@link #completePhase(TestResult)}.
 */
public class WorkflowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);

    private final WorkflowStateStore store;
    private final VersionControlAdapter vcs;
    private final TaskRepository taskRepository;
    private final TestResultValidator validator;
    private final CommitMessageGenerator commitMessageGenerator;
    private final EventBus eventBus;
    private final WorkflowMetrics metrics;
    private final WorkflowOptions options;
    private final Clock clock;

    private final TransitionTable transitions = TransitionTable.standard();
    private final NextActionTable nextActions = NextActionTable.standard();
    private final BranchNameGenerator branchNames;

    public WorkflowStateMachine(WorkflowStateStore store,
                                VersionControlAdapter vcs,
                                TaskRepository taskRepository,
                                TestResultValidator validator,
                                CommitMessageGenerator commitMessageGenerator,
                                EventBus eventBus,
                                WorkflowMetrics metrics,
                                WorkflowOptions options) {
        this(store, vcs, taskRepository, validator, commitMessageGenerator, eventBus, metrics, options,
                Clock.systemUTC());
    }

    public WorkflowStateMachine(WorkflowStateStore store,
                                VersionControlAdapter vcs,
                                TaskRepository taskRepository,
                                TestResultValidator validator,
                                CommitMessageGenerator commitMessageGenerator,
                                EventBus eventBus,
                                WorkflowMetrics metrics,
                                WorkflowOptions options,
                                Clock clock) {
        this.store = store;
        this.vcs = vcs;
        this.taskRepository = taskRepository;
        this.validator = validator;
        this.commitMessageGenerator = commitMessageGenerator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.options = options;
        this.clock = clock;
        this.branchNames = new BranchNameGenerator(options.branchPattern());
    }

    // ── start ───────────────────────────────────────────────────────

    public WorkflowStatus start(String taskId, List<Subtask> subtasks) {
        return start(StartOptions.of(taskId, subtasks));
    }

    /**
     * Loads the task from the repository and starts a workflow for it.
     *
     * @throws TaskNotFoundException when the task is not in the group
     */
    public WorkflowStatus startTask(String taskId, String tag, boolean force) {
        String group = tag == null || tag.isBlank() ? options.defaultGroup() : tag;
        var task = taskRepository.findTask(taskId, group)
                .orElseThrow(() -> new TaskNotFoundException(taskId, group));
        return start(StartOptions.forTask(task, tag, force));
    }

    /**
     * Creates the workflow, sets up the branch and enters RED for the first incomplete subtask.
     * <p>
     * An existing workflow is rejected unless {@code force} is set, it is COMPLETE, or it is
     * the same task stopped during setup (setup then continues where it stopped).
     */
    public synchronized WorkflowStatus start(StartOptions startOptions) {
        requireText(startOptions.taskId(), "taskId");
        if (startOptions.subtasks().isEmpty()) {
            throw new IllegalArgumentException("Task " + startOptions.taskId() + " has no subtasks to work on");
        }

        MdcContext.setTask(startOptions.taskId());
        try {
            WorkflowState setupInProgress = checkExisting(startOptions);

            if (setupInProgress == null && options.requireCleanStart() && !vcs.isWorkingTreeClean()) {
                throw new DirtyWorkingTreeException(
                        "Cannot start workflow: working tree has uncommitted changes", vcs.getStatusSummary());
            }

            WorkflowState state;
            if (setupInProgress != null) {
                log.info("Continuing interrupted setup for task {} from {}",
                        startOptions.taskId(), setupInProgress.phase());
                state = setupInProgress;
            } else {
                state = new WorkflowState(WorkflowPhase.PREFLIGHT, initialContext(startOptions));
                store.save(state);
                log.info("Starting workflow for task {} with {} subtask(s)",
                        startOptions.taskId(), state.context().subtasks().size());
                publish(WorkflowEventType.WORKFLOW_STARTED, state, null, payload(
                        "subtaskCount", state.context().subtasks().size(),
                        "startIndex", state.context().currentSubtaskIndex()));
            }

            if (state.phase() == WorkflowPhase.PREFLIGHT) {
                state = transition(state, Trigger.PREFLIGHT_COMPLETE, state.context());
            }

            String branch = setupBranch(state.context());
            state = transition(state, Trigger.BRANCH_CREATED, markCurrentInProgress(
                    state.context().withBranchName(branch).withTddPhase(TddPhase.RED)));

            SubtaskInfo first = state.context().currentSubtask().orElseThrow();
            publish(WorkflowEventType.SUBTASK_STARTED, state, first.id(), payload("title", first.title()));
            metrics.recordWorkflowResult("started");
            return WorkflowStatus.of(state);
        } catch (WorkflowException e) {
            publishError(startOptions.taskId(), null, WorkflowPhase.PREFLIGHT, e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private WorkflowState checkExisting(StartOptions startOptions) {
        if (!store.exists()) {
            return null;
        }
        if (startOptions.force()) {
            log.warn("Discarding existing workflow for project {} (force)", store.projectRoot());
            return null;
        }
        WorkflowState existing = store.load();
        WorkflowPhase phase = existing.phase();
        if (phase == WorkflowPhase.COMPLETE) {
            log.info("Replacing completed workflow for task {}", existing.context().taskId());
            return null;
        }
        boolean sameTask = startOptions.taskId().equals(existing.context().taskId());
        if (sameTask && (phase == WorkflowPhase.PREFLIGHT || phase == WorkflowPhase.BRANCH_SETUP)) {
            return existing;
        }
        throw new InvalidTransitionException(
                "Workflow already exists for task " + existing.context().taskId() + " (phase " + phase + "). "
                        + "Use force to override or resume the existing workflow.",
                "Resume with: taskpilot autopilot resume");
    }

    private WorkflowContext initialContext(StartOptions startOptions) {
        int maxAttempts = startOptions.maxAttempts() != null ? startOptions.maxAttempts() : options.maxAttempts();
        var subtasks = new ArrayList<SubtaskInfo>();
        int startIndex = -1;
        for (Subtask subtask : startOptions.subtasks()) {
            SubtaskStatus status = subtask.isDone() ? SubtaskStatus.COMPLETED : SubtaskStatus.PENDING;
            if (startIndex < 0 && status != SubtaskStatus.COMPLETED) {
                startIndex = subtasks.size();
            }
            subtasks.add(new SubtaskInfo(subtask.id(), subtask.title(), status, 0, maxAttempts));
        }
        if (startIndex < 0) {
            throw new InvalidTransitionException(
                    "All subtasks for task " + startOptions.taskId() + " are already completed. Nothing to do.");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("startedAt", clock.instant().toString());
        if (startOptions.taskTitle() != null) {
            metadata.put("taskTitle", startOptions.taskTitle());
        }
        if (startOptions.tag() != null && !startOptions.tag().isBlank()) {
            metadata.put("tag", startOptions.tag());
        }
        if (startIndex > 0) {
            metadata.put("resumedFromSubtask", subtasks.get(startIndex).id());
            log.info("Skipping {} completed subtask(s); starting at {}", startIndex, subtasks.get(startIndex).id());
        }
        return WorkflowContext.initial(startOptions.taskId(), subtasks, startIndex, metadata);
    }

    private String setupBranch(WorkflowContext ctx) {
        String branch = branchNames.generate(ctx.taskId(),
                (String) ctx.metadata().get("taskTitle"),
                (String) ctx.metadata().get("tag"));
        String current = vcs.getCurrentBranch();
        if (branch.equals(current)) {
            log.info("Already on branch {}", branch);
        } else if (vcs.branchExists(branch)) {
            log.info("Checking out existing branch {}", branch);
            vcs.checkoutBranch(branch);
        } else {
            log.info("Creating branch {} from {}", branch, current);
            vcs.createBranch(branch, true);
            eventBus.publish(WorkflowEvent.of(WorkflowEventType.GIT_BRANCH_CREATED, ctx.taskId(), null,
                    payload("branch", branch, "from", current)));
        }
        return branch;
    }

    // ── queries ─────────────────────────────────────────────────────

    /**
     * Loads the persisted workflow and returns its status. Nothing is written.
     *
     * @throws com.taskpilot.core.persistence.WorkflowNotFoundException when no workflow exists
     */
    public WorkflowStatus resume() {
        WorkflowState state = store.load();
        log.info("Resumed workflow for task {} at {}", state.context().taskId(), StatePoint.of(state));
        return WorkflowStatus.of(state);
    }

    public WorkflowStatus getStatus() {
        return WorkflowStatus.of(store.load());
    }

    public NextAction getNextAction() {
        return nextActions.lookup(store.load());
    }

    public boolean hasWorkflow() {
        return store.exists();
    }

    // ── completePhase ───────────────────────────────────────────────

    /**
     * Reports the test run for the current RED or GREEN step.
     * <p>
     * A RED run with no failures means the feature already exists: the subtask is marked
     * completed and the workflow goes straight to COMMIT. Any run rejected during GREEN counts
     * against the subtask's attempt budget.
     *
     * @throws TestValidationException            when the result is malformed or breaks the phase rules
     * @throws CoverageThresholdNotMetException   when GREEN passes but coverage is below threshold
     * @throws InvalidTransitionException         outside RED and GREEN
     */
    public synchronized WorkflowStatus completePhase(TestResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Test result is required");
        }
        WorkflowState state = store.load();
        StatePoint from = StatePoint.of(state);
        WorkflowContext ctx = state.context();
        SubtaskInfo subtask = ctx.currentSubtask().orElse(null);
        MdcContext.setSubtask(ctx.taskId(), subtask == null ? null : subtask.id(),
                from.tddPhase() == null ? null : from.tddPhase().name());
        try {
            if (!transitions.isLegal(from, Operation.COMPLETE_PHASE) || subtask == null) {
                throw new InvalidTransitionException(
                        from.tddPhase() == TddPhase.COMMIT
                                ? "Cannot complete COMMIT phase with test results. Use commit() instead."
                                : "Cannot complete a TDD phase in " + from,
                        nextActions.lookup(state).nextSteps().get(0));
            }

            boolean red = from.tddPhase() == TddPhase.RED;
            ValidationResult structure = validator.validate(result);
            if (!structure.valid()) {
                TestValidationException error = new TestValidationException(structure);
                throw red ? rejected(state, subtask, error, "validation")
                        : countFailedAttempt(state, subtask, error, "validation");
            }
            TestPhase expected = red ? TestPhase.RED : TestPhase.GREEN;
            if (!matches(expected, result.phase())) {
                TestValidationException error = new TestValidationException(
                        "Test result phase " + result.phase() + " does not match current TDD phase "
                                + from.tddPhase());
                throw red ? rejected(state, subtask, error, "validation")
                        : countFailedAttempt(state, subtask, error, "validation");
            }

            publish(WorkflowEventType.TEST_RUN, state, subtask.id(), payload(
                    "phase", result.phase().name(),
                    "total", result.total(),
                    "passed", result.passed(),
                    "failed", result.failed(),
                    "skipped", result.skipped()));

            WorkflowState next = red
                    ? completeRed(state, subtask, result)
                    : completeGreen(state, subtask, result);
            return WorkflowStatus.of(next);
        } finally {
            MdcContext.clear();
        }
    }

    private WorkflowState completeRed(WorkflowState state, SubtaskInfo subtask, TestResult result) {
        if (result.failed() == 0) {
            log.info("Subtask {} already satisfied: {} passing test(s) and no failures", subtask.id(), result.passed());
            WorkflowContext ctx = state.context()
                    .withCurrentSubtask(subtask.withStatus(SubtaskStatus.COMPLETED))
                    .withLastTestResults(result)
                    .withTddPhase(TddPhase.COMMIT);
            WorkflowState next = transition(state, Trigger.RED_ALREADY_SATISFIED, ctx);
            publish(WorkflowEventType.TDD_FEATURE_ALREADY_IMPLEMENTED, next, subtask.id(),
                    payload("passed", result.passed()));
            metrics.recordPhaseCompletion(TddPhase.RED.name(), true);
            return next;
        }

        ValidationResult red = validator.validatePhase(result, PhaseValidationOptions.forPhase(TestPhase.RED));
        if (!red.valid()) {
            throw rejected(state, subtask, new TestValidationException(red), "validation");
        }

        WorkflowContext ctx = state.context()
                .withLastTestResults(result)
                .withTddPhase(TddPhase.GREEN);
        WorkflowState next = transition(state, Trigger.RED_COMPLETE, ctx);
        log.info("RED complete for subtask {}: {} failing test(s)", subtask.id(), result.failed());
        publish(WorkflowEventType.TDD_RED_COMPLETED, next, subtask.id(), payload("failed", result.failed()));
        metrics.recordPhaseCompletion(TddPhase.RED.name(), false);
        return next;
    }

    private WorkflowState completeGreen(WorkflowState state, SubtaskInfo subtask, TestResult result) {
        TestResult previous = state.context().lastTestResults();
        Integer previousTotal = previous == null ? null : previous.total();
        var validation = new PhaseValidationOptions(TestPhase.GREEN, previousTotal,
                options.coverage().isEmpty() ? null : options.coverage());

        ValidationResult green = validator.validatePhase(result, validation);
        if (!green.valid()) {
            boolean coverageOnly = validator.validateGreenPhase(result, previousTotal).valid();
            TestValidationException error = coverageOnly
                    ? new CoverageThresholdNotMetException(green)
                    : new TestValidationException(green);
            throw countFailedAttempt(state, subtask, error, coverageOnly ? "coverage" : "validation");
        }
        green.warnings().forEach(w -> log.warn("GREEN warning for subtask {}: {}", subtask.id(), w));

        WorkflowContext ctx = state.context()
                .withLastTestResults(result)
                .withTddPhase(TddPhase.COMMIT);
        WorkflowState next = transition(state, Trigger.GREEN_COMPLETE, ctx);
        log.info("GREEN complete for subtask {}: {} passing test(s)", subtask.id(), result.passed());
        publish(WorkflowEventType.TDD_GREEN_COMPLETED, next, subtask.id(), payload(
                "passed", result.passed(),
                "warnings", green.warnings()));
        metrics.recordPhaseCompletion(TddPhase.GREEN.name(), false);
        return next;
    }

    /**
     * Records a rejected RED run; RED has no attempt budget.
     */
    private TestValidationException rejected(WorkflowState state, SubtaskInfo subtask,
                                             TestValidationException error, String reason) {
        String tdd = state.context().currentTddPhase().name();
        log.warn("Rejected {} test result for subtask {}: {}", tdd, subtask.id(), error.getMessage());
        WorkflowState updated = state.withContext(state.context().withError(errorOf(state, error)));
        store.save(updated);
        metrics.recordValidationFailure(tdd, reason);
        publishError(state.context().taskId(), subtask.id(), state.phase(), error);
        return error;
    }

    private TestValidationException countFailedAttempt(WorkflowState state, SubtaskInfo subtask,
                                                       TestValidationException error, String reason) {
        SubtaskInfo attempted = subtask.withAttempts(subtask.attempts() + 1);
        log.warn("GREEN attempt {} of {} failed for subtask {}: {}", attempted.attempts(),
                attempted.maxAttempts(), subtask.id(), error.getMessage());

        boolean exhausted = attempted.attemptsExceeded();
        if (exhausted) {
            attempted = attempted.withStatus(SubtaskStatus.FAILED);
        }
        WorkflowState updated = state.withContext(state.context()
                .withCurrentSubtask(attempted)
                .withError(errorOf(state, error)));
        metrics.recordValidationFailure(TddPhase.GREEN.name(), reason);

        if (exhausted && options.abortOnMaxAttempts()) {
            log.warn("Subtask {} exceeded {} attempts; aborting workflow", subtask.id(), attempted.maxAttempts());
            store.delete();
            publish(WorkflowEventType.SUBTASK_FAILED, updated, subtask.id(), payload("attempts", attempted.attempts()));
            publish(WorkflowEventType.WORKFLOW_ABORTED, updated, null, payload("reason", "max-attempts"));
            metrics.recordWorkflowResult("aborted");
        } else {
            store.save(updated);
            if (exhausted) {
                publish(WorkflowEventType.SUBTASK_FAILED, updated, subtask.id(), payload("attempts", attempted.attempts()));
            }
        }
        publishError(state.context().taskId(), subtask.id(), state.phase(), error);
        return error;
    }

    // ── commit ──────────────────────────────────────────────────────

    /**
     * Commits the current subtask's changes and advances to the next subtask's RED step, or to
     * FINALIZE after the last one. Stages everything when nothing is staged.
     */
    public synchronized WorkflowStatus commit() {
        WorkflowState state = store.load();
        StatePoint from = StatePoint.of(state);
        WorkflowContext ctx = state.context();
        SubtaskInfo subtask = ctx.currentSubtask().orElse(null);
        MdcContext.setSubtask(ctx.taskId(), subtask == null ? null : subtask.id(),
                from.tddPhase() == null ? null : from.tddPhase().name());
        try {
            if (!transitions.isLegal(from, Operation.COMMIT) || subtask == null) {
                throw new InvalidTransitionException(
                        "Cannot commit in " + from + ". Complete RED and GREEN phases first.",
                        nextActions.lookup(state).nextSteps().get(0));
            }

            long started = System.nanoTime();
            if (!vcs.hasStagedChanges()) {
                log.info("No staged changes, staging all changes");
                vcs.stageFiles(List.of("."));
            }
            List<String> changedFiles = vcs.getChangedFiles();
            String message = commitMessage(ctx, subtask, changedFiles);

            Map<String, String> trailerMetadata = new LinkedHashMap<>();
            trailerMetadata.put("taskId", ctx.taskId());
            trailerMetadata.put("subtaskId", subtask.id());
            trailerMetadata.put("phase", TddPhase.COMMIT.name());
            trailerMetadata.put("tddCycle", "complete");
            vcs.createCommit(message, new CommitOptions(trailerMetadata, false, true));
            String sha = vcs.getLastCommitSha();
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            log.info("Committed subtask {} as {} ({} file(s), {}ms)", subtask.id(), sha, changedFiles.size(), elapsedMs);
            metrics.recordCommit(elapsedMs);
            publish(WorkflowEventType.GIT_COMMIT_CREATED, state, subtask.id(), payload(
                    "sha", sha,
                    "message", message.lines().findFirst().orElse(""),
                    "files", changedFiles.size()));

            WorkflowContext committed = ctx
                    .withCurrentSubtask(subtask.withStatus(SubtaskStatus.COMPLETED))
                    .withMetadata("lastCommit", sha);
            int nextIndex = nextIncompleteIndex(committed);

            WorkflowState next;
            if (nextIndex < 0) {
                next = transition(state, Trigger.LAST_COMMIT_COMPLETE, committed
                        .withCurrentSubtaskIndex(committed.subtasks().size())
                        .withTddPhase(null));
                publish(WorkflowEventType.SUBTASK_COMPLETED, next, subtask.id(), payload("sha", sha));
            } else {
                next = transition(state, Trigger.COMMIT_COMPLETE, markCurrentInProgress(committed
                        .withCurrentSubtaskIndex(nextIndex)
                        .withTddPhase(TddPhase.RED)));
                publish(WorkflowEventType.SUBTASK_COMPLETED, next, subtask.id(), payload("sha", sha));
                SubtaskInfo upcoming = next.context().currentSubtask().orElseThrow();
                publish(WorkflowEventType.SUBTASK_STARTED, next, upcoming.id(), payload("title", upcoming.title()));
            }
            return WorkflowStatus.of(next);
        } catch (WorkflowException e) {
            publishError(ctx.taskId(), subtask == null ? null : subtask.id(), state.phase(), e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private String commitMessage(WorkflowContext ctx, SubtaskInfo subtask, List<String> changedFiles) {
        TestResult last = ctx.lastTestResults();
        String message = commitMessageGenerator.generateMessage(
                CommitMessageOptions.builder(options.commitType(), subtask.title())
                        .changedFiles(changedFiles)
                        .taskId(ctx.taskId())
                        .phase("TDD")
                        .tag((String) ctx.metadata().get("tag"))
                        .testsPassing(last == null ? null : last.passed())
                        .testsFailing(last == null ? null : last.failed())
                        .coveragePercent(last == null || last.coverage() == null ? null : last.coverage().line())
                        .build());
        if (options.coAuthor() != null && !options.coAuthor().isBlank()) {
            message = message.stripTrailing() + "\n\nCo-authored-by: " + options.coAuthor().trim();
        }
        return message;
    }

    private static int nextIncompleteIndex(WorkflowContext ctx) {
        List<SubtaskInfo> subtasks = ctx.subtasks();
        for (int i = ctx.currentSubtaskIndex() + 1; i < subtasks.size(); i++) {
            if (subtasks.get(i).status() != SubtaskStatus.COMPLETED) {
                return i;
            }
        }
        return -1;
    }

    // ── finalize / abort ────────────────────────────────────────────

    /**
     * Marks the task done and completes the workflow. A dirty working tree fails without
     * changing any state.
     */
    public synchronized WorkflowStatus finalizeWorkflow() {
        WorkflowState state = store.load();
        StatePoint from = StatePoint.of(state);
        WorkflowContext ctx = state.context();
        MdcContext.setTask(ctx.taskId());
        try {
            if (!transitions.isLegal(from, Operation.FINALIZE)) {
                throw new InvalidTransitionException(
                        "Cannot finalize workflow in " + from + ". Complete all subtasks first.",
                        nextActions.lookup(state).nextSteps().get(0));
            }

            GitStatusSummary summary = vcs.getStatusSummary();
            if (!summary.clean()) {
                throw new DirtyWorkingTreeException(
                        "Cannot finalize workflow: working tree has uncommitted changes", summary);
            }

            String tag = (String) ctx.metadata().get("tag");
            taskRepository.markDone(ctx.taskId(), tag == null ? options.defaultGroup() : tag);

            WorkflowState next = transition(state, Trigger.FINALIZE_COMPLETE,
                    ctx.withMetadata("completedAt", clock.instant().toString()));
            log.info("Workflow for task {} complete ({} subtask(s))", ctx.taskId(), ctx.subtasks().size());
            publish(WorkflowEventType.WORKFLOW_COMPLETED, next, null, payload(
                    "branch", ctx.branchName(),
                    "lastCommit", ctx.metadata().get("lastCommit")));
            metrics.recordWorkflowResult("completed");
            return WorkflowStatus.of(next);
        } catch (WorkflowException e) {
            publishError(ctx.taskId(), null, state.phase(), e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Deletes the persisted workflow. Safe to call at any time, including with no workflow.
     * Branches and commits are left alone.
     */
    public synchronized void abort() {
        if (!store.exists()) {
            log.debug("No workflow to abort in {}", store.projectRoot());
            return;
        }
        String taskId = null;
        try {
            taskId = store.load().context().taskId();
        } catch (WorkflowStateStoreException e) {
            log.warn("Aborting unreadable workflow state {}: {}", store.statePath(), e.getMessage());
        }
        try {
            store.delete();
        } catch (WorkflowStateStoreException e) {
            log.warn("Could not delete workflow state {}: {}", store.statePath(), e.getMessage());
            return;
        }
        log.info("Aborted workflow for task {}", taskId);
        eventBus.publish(WorkflowEvent.of(WorkflowEventType.WORKFLOW_ABORTED, taskId, null,
                payload("reason", "user")));
        metrics.recordWorkflowResult("aborted");
    }

    // ── helpers ─────────────────────────────────────────────────────

    private WorkflowState transition(WorkflowState state, Trigger trigger, WorkflowContext context) {
        StatePoint from = StatePoint.of(state);
        StatePoint to = transitions.require(from, trigger);
        WorkflowState next = new WorkflowState(to.phase(), context.withTddPhase(to.tddPhase()));
        store.save(next);
        log.debug("{} --{}--> {}", from, trigger, to);
        if (to.phase() != from.phase()) {
            publish(WorkflowEventType.PHASE_ENTERED, next, null, payload(
                    "from", from.phase().name(),
                    "to", to.phase().name()));
        }
        return next;
    }

    private static WorkflowContext markCurrentInProgress(WorkflowContext ctx) {
        return ctx.currentSubtask()
                .filter(s -> s.status() == SubtaskStatus.PENDING)
                .map(s -> ctx.withCurrentSubtask(s.withStatus(SubtaskStatus.IN_PROGRESS)))
                .orElse(ctx);
    }

    private static boolean matches(TestPhase expected, TestPhase actual) {
        // REFACTOR runs are judged by GREEN's rules
        return actual == expected || (expected == TestPhase.GREEN && actual == TestPhase.REFACTOR);
    }

    private WorkflowError errorOf(WorkflowState state, WorkflowException error) {
        return new WorkflowError(state.phase(), error.getMessage(), clock.instant(), error.recoverable());
    }

    private void publish(WorkflowEventType type, WorkflowState state, String subtaskId, Map<String, Object> payload) {
        eventBus.publish(WorkflowEvent.of(type, state.context().taskId(), subtaskId, payload));
    }

    private void publishError(String taskId, String subtaskId, WorkflowPhase phase, WorkflowException e) {
        eventBus.publish(WorkflowEvent.of(WorkflowEventType.ERROR_OCCURRED, taskId, subtaskId, payload(
                "kind", e.kind().name(),
                "phase", phase == null ? null : phase.name(),
                "message", e.getMessage(),
                "recoverable", e.recoverable())));
    }

    /**
     * Ordered payload from key/value pairs; null values are kept.
     */
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
