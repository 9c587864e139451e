package com.taskpilot.core.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a test run. Never thrown; callers decide how to surface it.
 *
 * @param valid       true when {@code errors} is empty
 * @param errors      rule violations
 * @param warnings    non-blocking observations (e.g. test count regression)
 * @param suggestions actionable guidance, one per problem where available
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    List<String> suggestions
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of(), List.of());
    }

    static ValidationResult of(List<String> errors, List<String> warnings, List<String> suggestions) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    /**
     * Combines two results; valid only when both are.
     */
    public ValidationResult merge(ValidationResult other) {
        return new ValidationResult(
                valid && other.valid,
                concat(errors, other.errors),
                concat(warnings, other.warnings),
                concat(suggestions, other.suggestions));
    }

    private static List<String> concat(List<String> a, List<String> b) {
        var out = new ArrayList<String>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
