package com.taskpilot.core.dependency;

import java.util.List;

/**
 * Result of validating every dependency in a group.
 */
public record DependencyValidationResult(boolean valid, List<DependencyIssue> issues) {

    public DependencyValidationResult {
        issues = List.copyOf(issues);
    }
}
