package com.taskpilot.core.engine;

/**
 * Caller-facing operations that move a workflow forward.
 */
public enum Operation {
    START,
    COMPLETE_PHASE,
    COMMIT,
    FINALIZE
}
