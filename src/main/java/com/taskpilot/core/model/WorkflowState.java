package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * The persisted unit of a workflow: its phase plus its context.
 */
public record WorkflowState(
    WorkflowPhase phase,
    WorkflowContext context
) implements Serializable {

    public WorkflowState withContext(WorkflowContext newContext) {
        return new WorkflowState(phase, newContext);
    }

    /**
     * TDD step, reported only while the subtask loop is active.
     */
    @JsonIgnore
    public TddPhase tddPhase() {
        return phase == WorkflowPhase.SUBTASK_LOOP ? context.currentTddPhase() : null;
    }
}
