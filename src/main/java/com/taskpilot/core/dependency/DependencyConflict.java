package com.taskpilot.core.dependency;

/**
 * A direct dependency of a task being moved whose owner is not in the destination group.
 *
 * @param taskId          the task being moved
 * @param dependencyId    the dependency as written on the task ("2" or "3.1")
 * @param dependencyGroup group the dependency's owner currently lives in
 */
public record DependencyConflict(
    String taskId,
    String dependencyId,
    String dependencyGroup
) {

    public String message() {
        return "Task %s depends on %s (in %s)".formatted(taskId, dependencyId, dependencyGroup);
    }
}
