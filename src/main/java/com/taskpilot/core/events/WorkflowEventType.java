package com.taskpilot.core.events;

/**
 * Event types emitted by the workflow engine. {@link #value()} is the wire name used in the
 * activity log.
 */
public enum WorkflowEventType {
    WORKFLOW_STARTED("workflow:started"),
    WORKFLOW_COMPLETED("workflow:completed"),
    WORKFLOW_ABORTED("workflow:aborted"),
    PHASE_ENTERED("phase:entered"),
    TDD_RED_COMPLETED("tdd:red:completed"),
    TDD_GREEN_COMPLETED("tdd:green:completed"),
    TDD_FEATURE_ALREADY_IMPLEMENTED("tdd:feature-already-implemented"),
    SUBTASK_STARTED("subtask:started"),
    SUBTASK_COMPLETED("subtask:completed"),
    SUBTASK_FAILED("subtask:failed"),
    TEST_RUN("test:run"),
    GIT_BRANCH_CREATED("git:branch:created"),
    GIT_COMMIT_CREATED("git:commit:created"),
    ERROR_OCCURRED("error:occurred");

    private final String value;

    WorkflowEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
