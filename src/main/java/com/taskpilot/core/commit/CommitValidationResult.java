package com.taskpilot.core.commit;

import java.util.List;

/**
 * Result of checking a message against the conventional-commit header format.
 */
public record CommitValidationResult(boolean valid, List<String> errors) {}
