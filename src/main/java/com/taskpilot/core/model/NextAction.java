package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Recommended next step for whoever drives the workflow (a person or an AI agent).
 *
 * @param action       machine-readable action key (e.g. "generate_test")
 * @param description  one-line summary
 * @param nextSteps    ordered hints
 * @param phase        workflow phase the recommendation was computed for
 * @param tddPhase     TDD step, null outside the subtask loop
 * @param subtaskId    current subtask, if any
 * @param subtaskTitle current subtask title, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextAction(
    String action,
    String description,
    List<String> nextSteps,
    WorkflowPhase phase,
    TddPhase tddPhase,
    String subtaskId,
    String subtaskTitle
) {}
