package com.taskpilot.core.git;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown when a git command fails. Carries the command's exit code and stderr.
 */
public class VersionControlException extends WorkflowException {

    private final int exitCode;
    private final String stderr;

    public VersionControlException(String message, int exitCode, String stderr) {
        super(ErrorKind.VERSION_CONTROL_FAILURE, withStderr(message, stderr), List.of());
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public VersionControlException(String message) {
        this(message, -1, "");
    }

    public VersionControlException(String message, Throwable cause) {
        super(ErrorKind.VERSION_CONTROL_FAILURE, message, List.of(), cause);
        this.exitCode = -1;
        this.stderr = "";
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String withStderr(String message, String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return message;
        }
        return message + ": " + stderr.strip();
    }
}
