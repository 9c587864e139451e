package com.taskpilot.core.engine;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown when an operation is not legal for the current phase / TDD phase.
 */
public class InvalidTransitionException extends WorkflowException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message, List.of());
    }

    public InvalidTransitionException(String message, String suggestion) {
        super(ErrorKind.INVALID_TRANSITION, message, List.of(suggestion));
    }
}
