package com.taskpilot.core.exception;

/**
 * Kinds of failure surfaced by the workflow engine and the dependency validator.
 */
public enum ErrorKind {
    INVALID_TRANSITION(true),
    VALIDATION_ERROR(true),
    COVERAGE_THRESHOLD_NOT_MET(true),
    WORKFLOW_NOT_FOUND(true),
    DIRTY_WORKING_TREE(true),
    VERSION_CONTROL_FAILURE(false),
    CYCLE_DETECTED(false),
    CROSS_GROUP_DEPENDENCY_CONFLICT(true);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
