package com.taskpilot.core.engine;

import com.taskpilot.core.model.NextAction;
import com.taskpilot.core.model.SubtaskInfo;
import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recommended next action for every {@link StatePoint}. Step texts may use {@code {taskId}},
 * {@code {subtaskId}} and {@code {subtaskTitle}}.
 */
public final class NextActionTable {

    record Entry(String action, String description, List<String> steps) {}

    private static final NextActionTable STANDARD = new NextActionTable(Map.of(
            StatePoint.of(WorkflowPhase.PREFLIGHT), new Entry(
                    "resume_setup",
                    "Workflow setup was interrupted",
                    List.of("Run taskpilot autopilot start {taskId} to finish preflight checks and branch setup.")),
            StatePoint.of(WorkflowPhase.BRANCH_SETUP), new Entry(
                    "resume_setup",
                    "Workflow setup was interrupted",
                    List.of("Run taskpilot autopilot start {taskId} to create or check out the working branch.")),
            StatePoint.loop(TddPhase.RED), new Entry(
                    "generate_test",
                    "Generate failing test for current subtask",
                    List.of(
                            "Write failing tests for subtask {subtaskId}: \"{subtaskTitle}\".",
                            "Create test file(s) that validate the expected behavior.",
                            "Run the tests and report the results with taskpilot autopilot complete --phase RED.",
                            "If all tests pass (0 failures), the feature is already implemented and the subtask will be auto-completed.")),
            StatePoint.loop(TddPhase.GREEN), new Entry(
                    "implement_code",
                    "Implement feature to make tests pass",
                    List.of(
                            "Implement code to make tests pass for subtask {subtaskId}: \"{subtaskTitle}\".",
                            "Write the minimal code needed to pass all tests.",
                            "Report the results with taskpilot autopilot complete --phase GREEN.")),
            StatePoint.loop(TddPhase.COMMIT), new Entry(
                    "commit_changes",
                    "Commit RED-GREEN cycle changes",
                    List.of(
                            "Review your changes for subtask {subtaskId}: \"{subtaskTitle}\".",
                            "Run taskpilot autopilot commit to create the commit and advance to the next subtask.")),
            StatePoint.of(WorkflowPhase.FINALIZE), new Entry(
                    "finalize_workflow",
                    "Finalize and complete the workflow",
                    List.of(
                            "All subtasks are complete.",
                            "Run taskpilot autopilot finalize to verify no uncommitted changes remain and mark the workflow as complete.")),
            StatePoint.of(WorkflowPhase.COMPLETE), new Entry(
                    "workflow_complete",
                    "All subtasks completed",
                    List.of("Review the entire implementation and merge your branch when ready."))));

    private final Map<StatePoint, Entry> entries;

    NextActionTable(Map<StatePoint, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static NextActionTable standard() {
        return STANDARD;
    }

    public boolean covers(StatePoint point) {
        return entries.containsKey(point);
    }

    public NextAction lookup(WorkflowState state) {
        StatePoint point = StatePoint.of(state);
        Entry entry = entries.get(point);
        if (entry == null) {
            throw new IllegalStateException("No next action defined for " + point);
        }

        SubtaskInfo subtask = state.phase() == WorkflowPhase.SUBTASK_LOOP
                ? state.context().currentSubtask().orElse(null)
                : null;
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{taskId}", state.context().taskId());
        values.put("{subtaskId}", subtask == null ? "" : subtask.id());
        values.put("{subtaskTitle}", subtask == null ? "" : subtask.title());

        List<String> steps = entry.steps().stream()
                .map(step -> substitute(step, values))
                .toList();
        return new NextAction(entry.action(), entry.description(), steps,
                point.phase(), point.tddPhase(),
                subtask == null ? null : subtask.id(),
                subtask == null ? null : subtask.title());
    }

    private static String substitute(String text, Map<String, String> values) {
        String out = text;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }
        return out;
    }
}
