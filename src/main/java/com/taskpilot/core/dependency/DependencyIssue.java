package com.taskpilot.core.dependency;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A problem found by {@link DependencyGraphValidator#validateTaskDependencies}.
 *
 * @param type         kind of problem
 * @param taskId       task or subtask ("3.1") with the problem
 * @param dependencyId offending dependency, null for circular issues
 * @param message      human-readable description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyIssue(
    Type type,
    String taskId,
    String dependencyId,
    String message
) {

    public enum Type { SELF, MISSING, CIRCULAR }
}
