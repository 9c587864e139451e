package com.taskpilot.core.git;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown when an operation requires a clean working tree and uncommitted changes exist.
 */
public class DirtyWorkingTreeException extends WorkflowException {

    private final GitStatusSummary summary;

    public DirtyWorkingTreeException(String message, GitStatusSummary summary) {
        super(ErrorKind.DIRTY_WORKING_TREE,
                message + "\nStaged: %d, Modified: %d, Deleted: %d, Untracked: %d".formatted(
                        summary.staged(), summary.modified(), summary.deleted(), summary.untracked()),
                List.of("Commit or stash your changes, then retry"));
        this.summary = summary;
    }

    public GitStatusSummary summary() {
        return summary;
    }
}
