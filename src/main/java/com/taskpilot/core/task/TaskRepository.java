package com.taskpilot.core.task;

import com.taskpilot.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Read access to tasks by group, plus the single write the workflow engine needs.
 */
public interface TaskRepository {

    List<Task> listTasks(String group);

    /**
     * Tasks of every group; the same id may appear once per group.
     */
    List<Task> listAllTasks();

    Optional<Task> findTask(String taskId, String group);

    /**
     * @throws TaskNotFoundException when the task does not exist in the group
     */
    void markDone(String taskId, String group);
}
