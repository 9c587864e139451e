package com.taskpilot.core.engine;

import com.taskpilot.core.model.Subtask;
import com.taskpilot.core.model.Task;

import java.util.List;

/**
 * Inputs for {@link WorkflowStateMachine#start(StartOptions)}.
 *
 * @param taskId      task to work on
 * @param taskTitle   used for the branch slug; optional
 * @param subtasks    subtasks in order; those already done are skipped
 * @param maxAttempts per-subtask GREEN attempt budget; the configured default when null
 * @param tag         task group; prefixes the branch name when set
 * @param force       discard any existing workflow for the project
 */
public record StartOptions(
    String taskId,
    String taskTitle,
    List<Subtask> subtasks,
    Integer maxAttempts,
    String tag,
    boolean force
) {

    public StartOptions {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public static StartOptions of(String taskId, List<Subtask> subtasks) {
        return new StartOptions(taskId, null, subtasks, null, null, false);
    }

    public static StartOptions forTask(Task task, String tag, boolean force) {
        return new StartOptions(task.id(), task.title(), task.subtasks(), null, tag, force);
    }

    public StartOptions withForce(boolean newForce) {
        return new StartOptions(taskId, taskTitle, subtasks, maxAttempts, tag, newForce);
    }
}
