package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Minimum coverage percentages. A null threshold is not enforced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoverageThresholds(
    Double line,
    Double branch,
    Double function,
    Double statement
) implements Serializable {

    public static CoverageThresholds none() {
        return new CoverageThresholds(null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return line == null && branch == null && function == null && statement == null;
    }
}
