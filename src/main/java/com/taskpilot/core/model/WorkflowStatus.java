package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read-only projection of a workflow returned to presentation layers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStatus(
    String taskId,
    WorkflowPhase phase,
    TddPhase tddPhase,
    String branchName,
    SubtaskInfo currentSubtask,
    List<WorkflowError> errors,
    Progress progress
) {

    public static WorkflowStatus of(WorkflowState state) {
        WorkflowContext ctx = state.context();
        return new WorkflowStatus(
                ctx.taskId(),
                state.phase(),
                state.tddPhase(),
                ctx.branchName(),
                state.phase() == WorkflowPhase.SUBTASK_LOOP ? ctx.currentSubtask().orElse(null) : null,
                ctx.errors(),
                ctx.progress());
    }
}
