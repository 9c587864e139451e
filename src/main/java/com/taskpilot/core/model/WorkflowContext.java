package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable-by-copy context of a single task workflow. Every {@code with*} method returns a
 * new instance; the state machine is the only writer.
 *
 * @param taskId              task being worked on
 * @param subtasks            ordered subtasks
 * @param currentSubtaskIndex index into {@code subtasks}; equals size once all are done
 * @param currentTddPhase     TDD step, null outside the subtask loop
 * @param branchName          working branch, null before branch setup
 * @param errors              recorded errors, oldest first
 * @param lastTestResults     most recent accepted test run
 * @param metadata            free-form values (startedAt, taskTitle, lastCommit, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowContext(
    String taskId,
    List<SubtaskInfo> subtasks,
    int currentSubtaskIndex,
    TddPhase currentTddPhase,
    String branchName,
    List<WorkflowError> errors,
    TestResult lastTestResults,
    Map<String, Object> metadata
) implements Serializable {

    public WorkflowContext {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        errors = errors == null ? List.of() : List.copyOf(errors);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static WorkflowContext initial(String taskId, List<SubtaskInfo> subtasks,
                                          int startIndex, Map<String, Object> metadata) {
        return new WorkflowContext(taskId, subtasks, startIndex, null, null,
                List.of(), null, metadata);
    }

    @JsonIgnore
    public Optional<SubtaskInfo> currentSubtask() {
        if (currentSubtaskIndex < 0 || currentSubtaskIndex >= subtasks.size()) {
            return Optional.empty();
        }
        return Optional.of(subtasks.get(currentSubtaskIndex));
    }

    public WorkflowContext withCurrentSubtask(SubtaskInfo replacement) {
        if (currentSubtask().isEmpty()) {
            return this;
        }
        var updated = new ArrayList<>(subtasks);
        updated.set(currentSubtaskIndex, replacement);
        return new WorkflowContext(taskId, updated, currentSubtaskIndex, currentTddPhase,
                branchName, errors, lastTestResults, metadata);
    }

    public WorkflowContext withCurrentSubtaskIndex(int index) {
        return new WorkflowContext(taskId, subtasks, index, currentTddPhase,
                branchName, errors, lastTestResults, metadata);
    }

    public WorkflowContext withTddPhase(TddPhase phase) {
        return new WorkflowContext(taskId, subtasks, currentSubtaskIndex, phase,
                branchName, errors, lastTestResults, metadata);
    }

    public WorkflowContext withBranchName(String name) {
        return new WorkflowContext(taskId, subtasks, currentSubtaskIndex, currentTddPhase,
                name, errors, lastTestResults, metadata);
    }

    public WorkflowContext withLastTestResults(TestResult results) {
        return new WorkflowContext(taskId, subtasks, currentSubtaskIndex, currentTddPhase,
                branchName, errors, results, metadata);
    }

    public WorkflowContext withError(WorkflowError error) {
        var updated = new ArrayList<>(errors);
        updated.add(error);
        return new WorkflowContext(taskId, subtasks, currentSubtaskIndex, currentTddPhase,
                branchName, updated, lastTestResults, metadata);
    }

    public WorkflowContext withMetadata(String key, Object value) {
        var updated = new LinkedHashMap<>(metadata);
        if (value == null) {
            updated.remove(key);
        } else {
            updated.put(key, value);
        }
        return new WorkflowContext(taskId, subtasks, currentSubtaskIndex, currentTddPhase,
                branchName, errors, lastTestResults, updated);
    }

    @JsonIgnore
    public Progress progress() {
        int completed = (int) subtasks.stream()
                .filter(s -> s.status() == SubtaskStatus.COMPLETED)
                .count();
        int total = subtasks.size();
        int current = Math.min(currentSubtaskIndex + 1, total);
        int percentage = total > 0 ? Math.round(completed * 100f / total) : 0;
        return new Progress(completed, total, current, percentage);
    }
}
