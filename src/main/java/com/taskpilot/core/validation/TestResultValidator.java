package com.taskpilot.core.validation;

import com.taskpilot.core.model.Coverage;
import com.taskpilot.core.model.CoverageThresholds;
import com.taskpilot.core.model.TestPhase;
import com.taskpilot.core.model.TestResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates test-run summaries against TDD phase rules and optional coverage thresholds.
 *
 * <p>All methods are pure. Problems are reported in the returned {@link ValidationResult},
 * never thrown, so callers can show every error and suggestion at once.
 */
@Service
public class TestResultValidator {

    /**
     * Structural check: non-negative counts, a phase, coverage within [0, 100]
     * and {@code total == passed + failed + skipped}.
     */
    public ValidationResult validate(TestResult result) {
        var errors = new ArrayList<String>();
        if (result == null) {
            return ValidationResult.of(List.of("Test result is required"), List.of(), List.of());
        }

        requireNonNegative("total", result.total(), errors);
        requireNonNegative("passed", result.passed(), errors);
        requireNonNegative("failed", result.failed(), errors);
        requireNonNegative("skipped", result.skipped(), errors);
        if (result.phase() == null) {
            errors.add("phase: Expected one of RED, GREEN, REFACTOR");
        }
        Coverage coverage = result.coverage();
        if (coverage != null) {
            requirePercentage("coverage.line", coverage.line(), errors);
            requirePercentage("coverage.branch", coverage.branch(), errors);
            requirePercentage("coverage.function", coverage.function(), errors);
            requirePercentage("coverage.statement", coverage.statement(), errors);
        }
        if (!errors.isEmpty()) {
            return ValidationResult.of(errors, List.of(), List.of());
        }

        // long arithmetic so that huge counts cannot overflow into a false match
        long sum = (long) result.passed() + result.failed() + result.skipped();
        if (sum != result.total()) {
            errors.add("Total tests must equal passed + failed + skipped");
        }
        return ValidationResult.of(errors, List.of(), List.of());
    }

    /**
     * RED requires at least one failing test in a non-empty suite.
     */
    public ValidationResult validateRedPhase(TestResult result) {
        ValidationResult base = validate(result);
        if (!base.valid()) {
            return base;
        }

        var errors = new ArrayList<String>();
        var suggestions = new ArrayList<String>();
        if (result.failed() == 0) {
            errors.add("RED phase must have at least one failing test");
            suggestions.add("Write failing tests first to follow TDD workflow");
        }
        if (result.total() == 0) {
            errors.add("Cannot validate empty test suite");
            suggestions.add("Add at least one test to begin TDD cycle");
        }
        return ValidationResult.of(errors, List.of(), suggestions);
    }

    /**
     * GREEN requires zero failures and at least one pass. A shrinking suite is only a warning.
     *
     * @param previousTestCount total of the previous run, or null to skip the regression check
     */
    public ValidationResult validateGreenPhase(TestResult result, Integer previousTestCount) {
        ValidationResult base = validate(result);
        if (!base.valid()) {
            return base;
        }

        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var suggestions = new ArrayList<String>();
        if (result.failed() > 0) {
            errors.add("GREEN phase must have zero failures");
            suggestions.add("Fix implementation to make all tests pass");
        }
        if (result.passed() == 0) {
            errors.add("GREEN phase must have at least one passing test");
            suggestions.add("Ensure tests exist and implementation makes them pass");
        }
        if (previousTestCount != null && result.total() < previousTestCount) {
            warnings.add("Test count decreased from %d to %d".formatted(previousTestCount, result.total()));
            suggestions.add("Verify that no tests were accidentally removed");
        }
        return ValidationResult.of(errors, warnings, suggestions);
    }

    /**
     * Compares reported coverage with each configured threshold. Runs without coverage
     * data pass; all gaps are folded into a single error.
     */
    public ValidationResult validateCoverage(TestResult result, CoverageThresholds thresholds) {
        ValidationResult base = validate(result);
        if (!base.valid()) {
            return base;
        }
        if (result.coverage() == null || thresholds == null) {
            return ValidationResult.ok();
        }

        Coverage coverage = result.coverage();
        var gaps = new ArrayList<String>();
        addGap("line", coverage.line(), thresholds.line(), gaps);
        addGap("branch", coverage.branch(), thresholds.branch(), gaps);
        addGap("function", coverage.function(), thresholds.function(), gaps);
        addGap("statement", coverage.statement(), thresholds.statement(), gaps);

        if (gaps.isEmpty()) {
            return ValidationResult.ok();
        }
        return ValidationResult.of(
                List.of("Coverage thresholds not met: " + String.join(", ", gaps)),
                List.of(),
                List.of("Add more tests to improve code coverage"));
    }

    /**
     * Dispatches on phase (REFACTOR follows GREEN's rules), then merges coverage validation
     * when thresholds are supplied and the phase rules passed.
     */
    public ValidationResult validatePhase(TestResult result, PhaseValidationOptions options) {
        TestPhase phase = options != null && options.phase() != null
                ? options.phase()
                : result == null ? null : result.phase();
        Integer previous = options == null ? null : options.previousTestCount();

        ValidationResult phaseResult = phase == TestPhase.RED
                ? validateRedPhase(result)
                : validateGreenPhase(result, previous);
        if (!phaseResult.valid()) {
            return phaseResult;
        }

        if (options != null && options.coverageThresholds() != null) {
            return phaseResult.merge(validateCoverage(result, options.coverageThresholds()));
        }
        return phaseResult;
    }

    private static void requireNonNegative(String field, int value, List<String> errors) {
        if (value < 0) {
            errors.add(field + ": Number must be greater than or equal to 0");
        }
    }

    private static void requirePercentage(String field, double value, List<String> errors) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            errors.add(field + ": Number must be between 0 and 100");
        }
    }

    private static void addGap(String metric, double actual, Double threshold, List<String> gaps) {
        if (threshold != null && actual < threshold) {
            gaps.add("%s coverage (%s%% < %s%%)".formatted(metric, actual, threshold));
        }
    }
}
