package com.taskpilot.core.validation;

import com.taskpilot.core.model.CoverageThresholds;
import com.taskpilot.core.model.TestPhase;

/**
 * Options for {@link TestResultValidator#validatePhase}.
 *
 * @param phase              phase to validate against; the result's own phase when null
 * @param previousTestCount  total of the previous run, for regression warnings (nullable)
 * @param coverageThresholds thresholds to enforce after the phase rules pass (nullable)
 */
public record PhaseValidationOptions(
    TestPhase phase,
    Integer previousTestCount,
    CoverageThresholds coverageThresholds
) {

    public static PhaseValidationOptions forPhase(TestPhase phase) {
        return new PhaseValidationOptions(phase, null, null);
    }
}
