package com.taskpilot.core.model;

/**
 * Phase a test run was reported for. REFACTOR runs are validated with GREEN rules.
 */
public enum TestPhase {
    RED,
    GREEN,
    REFACTOR
}
