package com.taskpilot.core.validation;

import com.taskpilot.core.model.Coverage;
import com.taskpilot.core.model.CoverageThresholds;
import com.taskpilot.core.model.TestPhase;
import com.taskpilot.core.model.TestResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TestResultValidatorTest {

    private final TestResultValidator validator = new TestResultValidator();

    @Nested
    @DisplayName("validate")
    class StructureTests {

        @ParameterizedTest
        @CsvSource({
                "3,1,1,1,true",
                "0,0,0,0,true",
                "4,1,1,1,false",
                "2,1,1,1,false",
                "1,-1,1,1,false",
                "-1,0,0,0,false"
        })
        @DisplayName("requires non-negative counts that add up")
        void countsMustAddUp(int total, int passed, int failed, int skipped, boolean valid) {
            var result = new TestResult(total, passed, failed, skipped, TestPhase.GREEN, null);

            assertEquals(valid, validator.validate(result).valid());
        }

        @Test
        @DisplayName("total mismatch names both sides")
        void totalMismatchMessage() {
            var result = validator.validate(new TestResult(5, 1, 1, 1, TestPhase.RED, null));

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).contains("Total tests must equal passed + failed + skipped"));
        }

        @Test
        @DisplayName("phase is required")
        void phaseRequired() {
            assertFalse(validator.validate(new TestResult(1, 1, 0, 0, null, null)).valid());
        }

        @Test
        @DisplayName("coverage must be a percentage")
        void coverageRange() {
            var result = new TestResult(1, 1, 0, 0, TestPhase.GREEN, new Coverage(101, 50, 50, 50));

            assertFalse(validator.validate(result).valid());
        }

        @Test
        @DisplayName("null result is an error, not an exception")
        void nullResult() {
            assertEquals(java.util.List.of("Test result is required"), validator.validate(null).errors());
        }
    }

    @Nested
    @DisplayName("RED phase")
    class RedTests {

        @ParameterizedTest
        @CsvSource({"5,0,0", "0,0,3", "1,0,0"})
        @DisplayName("zero failures always fails")
        void zeroFailuresFails(int passed, int failed, int skipped) {
            var result = validator.validateRedPhase(TestResult.of(TestPhase.RED, passed, failed, skipped));

            assertFalse(result.valid());
            assertTrue(result.errors().contains("RED phase must have at least one failing test"));
            assertTrue(result.suggestions().contains("Write failing tests first to follow TDD workflow"));
        }

        @ParameterizedTest
        @CsvSource({"0,1,0", "4,2,1", "0,7,0"})
        @DisplayName("at least one failure passes")
        void failuresPass(int passed, int failed, int skipped) {
            assertTrue(validator.validateRedPhase(TestResult.of(TestPhase.RED, passed, failed, skipped)).valid());
        }

        @Test
        @DisplayName("empty suite reports both problems")
        void emptySuite() {
            var result = validator.validateRedPhase(TestResult.of(TestPhase.RED, 0, 0, 0));

            assertEquals(2, result.errors().size());
            assertTrue(result.errors().contains("Cannot validate empty test suite"));
        }
    }

    @Nested
    @DisplayName("GREEN phase")
    class GreenTests {

        @Test
        @DisplayName("failures are an error")
        void failuresFail() {
            var result = validator.validateGreenPhase(TestResult.of(TestPhase.GREEN, 4, 1, 0), null);

            assertTrue(result.errors().contains("GREEN phase must have zero failures"));
        }

        @Test
        @DisplayName("no passing tests is an error")
        void noPasses() {
            var result = validator.validateGreenPhase(TestResult.of(TestPhase.GREEN, 0, 0, 2), null);

            assertFalse(result.valid());
        }

        @Test
        @DisplayName("shrinking suite is only a warning")
        void shrinkingSuiteWarns() {
            var result = validator.validateGreenPhase(TestResult.of(TestPhase.GREEN, 3, 0, 0), 5);

            assertTrue(result.valid());
            assertEquals(java.util.List.of("Test count decreased from 5 to 3"), result.warnings());
        }
    }

    @Nested
    @DisplayName("coverage")
    class CoverageTests {

        private final TestResult covered =
                new TestResult(2, 2, 0, 0, TestPhase.GREEN, new Coverage(70, 60, 90, 85));

        @Test
        @DisplayName("all gaps are folded into one error")
        void gapsAggregated() {
            var result = validator.validateCoverage(covered, new CoverageThresholds(80.0, 70.0, 80.0, null));

            assertEquals(1, result.errors().size());
            assertEquals("Coverage thresholds not met: line coverage (70.0% < 80.0%), branch coverage (60.0% < 70.0%)",
                    result.errors().get(0));
            assertEquals(java.util.List.of("Add more tests to improve code coverage"), result.suggestions());
        }

        @Test
        @DisplayName("no coverage reported is a no-op")
        void noCoverage() {
            var result = validator.validateCoverage(TestResult.of(TestPhase.GREEN, 1, 0, 0),
                    new CoverageThresholds(99.0, 99.0, 99.0, 99.0));

            assertTrue(result.valid());
        }
    }

    @Nested
    @DisplayName("validatePhase")
    class PhaseTests {

        @Test
        @DisplayName("REFACTOR follows GREEN rules")
        void refactorUsesGreen() {
            var result = validator.validatePhase(TestResult.of(TestPhase.REFACTOR, 0, 1, 0),
                    PhaseValidationOptions.forPhase(TestPhase.REFACTOR));

            assertTrue(result.errors().contains("GREEN phase must have zero failures"));
        }

        @Test
        @DisplayName("merges coverage after phase rules pass")
        void mergesCoverage() {
            var result = validator.validatePhase(
                    new TestResult(2, 2, 0, 0, TestPhase.GREEN, new Coverage(50, 50, 50, 50)),
                    new PhaseValidationOptions(TestPhase.GREEN, 4, new CoverageThresholds(80.0, null, null, null)));

            assertFalse(result.valid());
            assertEquals(1, result.warnings().size());
            assertTrue(result.errors().get(0).startsWith("Coverage thresholds not met"));
        }
    }
}
