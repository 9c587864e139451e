package com.taskpilot.core.dependency;

/**
 * How an accepted cross-group move deals with its dependency conflicts.
 */
public enum MoveResolution {
    /** No conflicts, nothing to resolve. */
    NONE,
    /** Conflicting dependencies (and their own dependencies) move too. */
    WITH_DEPENDENCIES,
    /** Conflicting dependencies are severed. */
    IGNORE_DEPENDENCIES
}
