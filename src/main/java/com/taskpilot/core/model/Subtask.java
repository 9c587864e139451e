package com.taskpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A subtask from the task repository. Dependencies without a dot refer to sibling subtasks
 * when such a sibling exists, otherwise to a top-level task.
 */
public record Subtask(
    String id,
    String title,
    String status,
    List<String> dependencies
) implements Serializable {

    public Subtask {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean isDone() {
        return "done".equalsIgnoreCase(status) || "completed".equalsIgnoreCase(status);
    }
}
