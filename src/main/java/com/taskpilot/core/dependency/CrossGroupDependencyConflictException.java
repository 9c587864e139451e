package com.taskpilot.core.dependency;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.stream.Collectors;

/**
 * Thrown when a cross-group move has dependency conflicts and no resolution was chosen.
 */
public class CrossGroupDependencyConflictException extends WorkflowException {

    private final DependencyConflictReport report;

    public CrossGroupDependencyConflictException(String taskId, String targetGroup,
                                                 DependencyConflictReport report) {
        super(ErrorKind.CROSS_GROUP_DEPENDENCY_CONFLICT,
                "Cannot move task %s to '%s': %d cross-group dependency conflict(s): %s".formatted(
                        taskId, targetGroup, report.conflicts().size(),
                        report.conflicts().stream()
                                .map(DependencyConflict::message)
                                .collect(Collectors.joining("; "))),
                report.suggestions());
        this.report = report;
    }

    public DependencyConflictReport report() {
        return report;
    }
}
