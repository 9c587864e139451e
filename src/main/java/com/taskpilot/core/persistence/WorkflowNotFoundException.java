package com.taskpilot.core.persistence;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown when an operation needs a persisted workflow and none exists for the project.
 */
public class WorkflowNotFoundException extends WorkflowException {

    public WorkflowNotFoundException(String message) {
        super(ErrorKind.WORKFLOW_NOT_FOUND, message,
                List.of("Start a workflow first: taskpilot autopilot start <taskId>"));
    }
}
