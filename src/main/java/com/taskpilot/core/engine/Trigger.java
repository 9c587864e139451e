package com.taskpilot.core.engine;

/**
 * Internal events that drive the transition table. Each belongs to exactly one operation.
 */
public enum Trigger {
    PREFLIGHT_COMPLETE(Operation.START),
    BRANCH_CREATED(Operation.START),
    RED_COMPLETE(Operation.COMPLETE_PHASE),
    /** RED run had no failures: the feature already exists. */
    RED_ALREADY_SATISFIED(Operation.COMPLETE_PHASE),
    GREEN_COMPLETE(Operation.COMPLETE_PHASE),
    COMMIT_COMPLETE(Operation.COMMIT),
    LAST_COMMIT_COMPLETE(Operation.COMMIT),
    FINALIZE_COMPLETE(Operation.FINALIZE);

    private final Operation operation;

    Trigger(Operation operation) {
        this.operation = operation;
    }

    public Operation operation() {
        return operation;
    }
}
