package com.taskpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A task from the task repository. Consumed, never owned, by the workflow engine.
 *
 * @param id           task identifier (e.g. "7")
 * @param title        task title
 * @param status       repository status string ("pending", "in-progress", "done", ...)
 * @param dependencies ids of tasks or subtasks ("3", "3.1") this task depends on
 * @param group        tag the task belongs to (e.g. "master", "backlog")
 * @param subtasks     subtasks, in order
 */
public record Task(
    String id,
    String title,
    String status,
    List<String> dependencies,
    String group,
    List<Subtask> subtasks
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public static Task of(String id, String group, String... dependencies) {
        return new Task(id, "Task " + id, "pending", List.of(dependencies), group, List.of());
    }

    public boolean isDone() {
        return "done".equalsIgnoreCase(status) || "completed".equalsIgnoreCase(status);
    }
}
