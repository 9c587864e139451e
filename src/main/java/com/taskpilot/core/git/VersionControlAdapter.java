package com.taskpilot.core.git;

import java.util.List;

/**
 * Version-control operations the workflow engine needs. Every method either succeeds or throws
 * {@link VersionControlException}; implementations do not retry.
 */
public interface VersionControlAdapter {

    List<String> DEFAULT_BRANCHES = List.of("main", "master", "develop");

    boolean isWorkingTreeClean();

    GitStatusSummary getStatusSummary();

    String getCurrentBranch();

    boolean branchExists(String branchName);

    void createBranch(String branchName, boolean checkout);

    void checkoutBranch(String branchName);

    void stageFiles(List<String> paths);

    boolean hasStagedChanges();

    /**
     * Paths with staged, unstaged or untracked changes, relative to the repository root.
     */
    List<String> getChangedFiles();

    void createCommit(String message, CommitOptions options);

    String getLastCommitSha();

    default boolean isDefaultBranch(String branchName) {
        return DEFAULT_BRANCHES.contains(branchName);
    }
}
