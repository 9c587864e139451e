package com.taskpilot.core.dependency;

/**
 * Resolution flags for a cross-group move. At most one may be set.
 *
 * @param withDependencies   bring conflicting dependencies along
 * @param ignoreDependencies move anyway and sever the conflicting dependencies
 */
public record MoveOptions(boolean withDependencies, boolean ignoreDependencies) {

    public static MoveOptions none() {
        return new MoveOptions(false, false);
    }

    public static MoveOptions bringDependencies() {
        return new MoveOptions(true, false);
    }

    public static MoveOptions severDependencies() {
        return new MoveOptions(false, true);
    }
}
