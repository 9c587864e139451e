package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Structured summary of a test run submitted to complete a TDD phase.
 * The engine never runs tests itself; it only judges these counts.
 *
 * @param total    number of tests executed (must equal passed + failed + skipped)
 * @param passed   passing tests
 * @param failed   failing tests
 * @param skipped  skipped tests
 * @param phase    phase the run was made for
 * @param coverage optional coverage report
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResult(
    int total,
    int passed,
    int failed,
    int skipped,
    TestPhase phase,
    Coverage coverage
) implements Serializable {

    public static TestResult of(TestPhase phase, int passed, int failed, int skipped) {
        return new TestResult(passed + failed + skipped, passed, failed, skipped, phase, null);
    }
}
