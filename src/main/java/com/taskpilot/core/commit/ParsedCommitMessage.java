package com.taskpilot.core.commit;

/**
 * A conventional-commit message split into its parts. {@code scope} and {@code body} may be null.
 */
public record ParsedCommitMessage(
    String type,
    String scope,
    boolean breaking,
    String description,
    String body
) {}
