package com.taskpilot.core.model;

/**
 * Step of the test-driven cycle repeated for each subtask. Only meaningful while the
 * workflow is in {@link WorkflowPhase#SUBTASK_LOOP}.
 */
public enum TddPhase {
    RED,
    GREEN,
    COMMIT
}
