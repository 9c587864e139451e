package com.taskpilot.core.engine;

import com.taskpilot.core.config.TaskpilotProperties;
import com.taskpilot.core.model.CoverageThresholds;

/**
 * Policy knobs for {@link WorkflowStateMachine}.
 *
 * @param branchPattern      branch name pattern, see {@link BranchNameGenerator}
 * @param maxAttempts        default GREEN attempt budget per subtask
 * @param abortOnMaxAttempts delete the workflow once a subtask runs out of attempts
 * @param requireCleanStart  refuse to start on a dirty working tree
 * @param commitType         conventional-commit type for subtask commits
 * @param coAuthor           {@code "Name <email>"} for a Co-authored-by trailer; null for none
 * @param coverage           thresholds enforced on GREEN; {@link CoverageThresholds#none()} to skip
 * @param defaultGroup       task group used when the workflow has no tag
 */
public record WorkflowOptions(
    String branchPattern,
    int maxAttempts,
    boolean abortOnMaxAttempts,
    boolean requireCleanStart,
    String commitType,
    String coAuthor,
    CoverageThresholds coverage,
    String defaultGroup
) {

    public WorkflowOptions {
        if (branchPattern == null || branchPattern.isBlank()) {
            branchPattern = BranchNameGenerator.DEFAULT_PATTERN;
        }
        if (commitType == null || commitType.isBlank()) {
            commitType = "feat";
        }
        if (coverage == null) {
            coverage = CoverageThresholds.none();
        }
        if (defaultGroup == null || defaultGroup.isBlank()) {
            defaultGroup = "master";
        }
    }

    public static WorkflowOptions defaults() {
        return new WorkflowOptions(null, 3, false, true, null, null, null, null);
    }

    public static WorkflowOptions from(TaskpilotProperties properties) {
        TaskpilotProperties.Workflow workflow = properties.getWorkflow();
        TaskpilotProperties.Coverage coverage = properties.getCoverage();
        return new WorkflowOptions(
                workflow.getBranchPattern(),
                workflow.getMaxAttempts(),
                workflow.isAbortOnMaxAttempts(),
                workflow.isRequireCleanStart(),
                properties.getCommit().getType(),
                properties.getCommit().getCoAuthor(),
                new CoverageThresholds(coverage.getLine(), coverage.getBranch(),
                        coverage.getFunction(), coverage.getStatement()),
                properties.getTasks().getDefaultGroup());
    }

    public WorkflowOptions withRequireCleanStart(boolean value) {
        return new WorkflowOptions(branchPattern, maxAttempts, abortOnMaxAttempts, value,
                commitType, coAuthor, coverage, defaultGroup);
    }

    public WorkflowOptions withAbortOnMaxAttempts(boolean value) {
        return new WorkflowOptions(branchPattern, maxAttempts, value, requireCleanStart,
                commitType, coAuthor, coverage, defaultGroup);
    }

    public WorkflowOptions withCoverage(CoverageThresholds value) {
        return new WorkflowOptions(branchPattern, maxAttempts, abortOnMaxAttempts, requireCleanStart,
                commitType, coAuthor, value, defaultGroup);
    }

    public WorkflowOptions withCoAuthor(String value) {
        return new WorkflowOptions(branchPattern, maxAttempts, abortOnMaxAttempts, requireCleanStart,
                commitType, value, coverage, defaultGroup);
    }
}
