package com.taskpilot.core.task;

/**
 * Thrown when a task id does not resolve in the requested group.
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(String taskId, String group) {
        super("Task %s not found in group '%s'".formatted(taskId, group));
    }
}
