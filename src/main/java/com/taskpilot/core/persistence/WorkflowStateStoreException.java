package com.taskpilot.core.persistence;

/**
 * Thrown when workflow state cannot be read or written (I/O failure, corrupt file).
 */
public class WorkflowStateStoreException extends RuntimeException {

    public WorkflowStateStoreException(String message) {
        super(message);
    }

    public WorkflowStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
