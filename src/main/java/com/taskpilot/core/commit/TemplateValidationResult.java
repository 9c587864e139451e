package com.taskpilot.core.commit;

import java.util.List;

/**
 * Result of checking a template for required variables.
 */
public record TemplateValidationResult(boolean valid, List<String> missingVariables) {}
