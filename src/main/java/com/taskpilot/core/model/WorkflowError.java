package com.taskpilot.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An error recorded in the workflow history.
 */
public record WorkflowError(
    WorkflowPhase phase,
    String message,
    Instant timestamp,
    boolean recoverable
) implements Serializable {}
