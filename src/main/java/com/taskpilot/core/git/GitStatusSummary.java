package com.taskpilot.core.git;

/**
 * Counts of working-tree changes by kind. A file may count in more than one bucket
 * (e.g. staged and then modified again).
 */
public record GitStatusSummary(
    boolean clean,
    int staged,
    int modified,
    int deleted,
    int untracked
) {

    public static final GitStatusSummary CLEAN = new GitStatusSummary(true, 0, 0, 0, 0);

    public int totalChanges() {
        return staged + modified + deleted + untracked;
    }
}
