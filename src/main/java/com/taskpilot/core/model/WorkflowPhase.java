package com.taskpilot.core.model;

/**
 * Top-level phase of a task workflow. Phases advance strictly in declaration order.
 */
public enum WorkflowPhase {
    PREFLIGHT,
    BRANCH_SETUP,
    SUBTASK_LOOP,
    FINALIZE,
    COMPLETE
}
