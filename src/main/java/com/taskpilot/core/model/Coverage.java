package com.taskpilot.core.model;

import java.io.Serializable;

/**
 * Coverage percentages reported alongside a test run, each expected in [0, 100].
 */
public record Coverage(
    double line,
    double branch,
    double function,
    double statement
) implements Serializable {}
