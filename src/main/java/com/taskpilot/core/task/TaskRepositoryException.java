package com.taskpilot.core.task;

/**
 * Thrown when the task file cannot be read, parsed or written.
 */
public class TaskRepositoryException extends RuntimeException {

    public TaskRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
