package com.taskpilot.core.validation;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown by the workflow engine when a submitted test run does not satisfy the current phase.
 */
public class TestValidationException extends WorkflowException {

    private final ValidationResult result;

    public TestValidationException(ValidationResult result) {
        this(ErrorKind.VALIDATION_ERROR, "Test result validation failed: " + String.join(", ", result.errors()),
                result);
    }

    public TestValidationException(String message) {
        this(ErrorKind.VALIDATION_ERROR, message,
                new ValidationResult(false, List.of(message), List.of(), List.of()));
    }

    protected TestValidationException(ErrorKind kind, String message, ValidationResult result) {
        super(kind, message, result.suggestions());
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }
}
