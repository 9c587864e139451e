package com.taskpilot.core.validation;

import com.taskpilot.core.exception.ErrorKind;

/**
 * A GREEN run that passed its phase rules but fell short of a coverage threshold.
 * The message lists every metric gap.
 */
public class CoverageThresholdNotMetException extends TestValidationException {

    public CoverageThresholdNotMetException(ValidationResult result) {
        super(ErrorKind.COVERAGE_THRESHOLD_NOT_MET, String.join(", ", result.errors()), result);
    }
}
