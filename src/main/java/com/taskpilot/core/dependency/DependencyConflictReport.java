package com.taskpilot.core.dependency;

import java.util.List;

/**
 * Conflicts blocking a move plus the remediations the caller may choose from.
 */
public record DependencyConflictReport(
    List<DependencyConflict> conflicts,
    List<String> suggestions
) {

    static final String MOVE_WITH_DEPENDENCIES = "Move with dependencies (bring dependencies along)";
    static final String IGNORE_DEPENDENCIES = "Ignore dependencies (sever the dependency)";
    static final String MOVE_DEPENDENCIES_FIRST = "Move dependencies first, then move the main task";

    public DependencyConflictReport {
        conflicts = List.copyOf(conflicts);
        suggestions = List.copyOf(suggestions);
    }

    public static DependencyConflictReport of(List<DependencyConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return new DependencyConflictReport(List.of(), List.of());
        }
        return new DependencyConflictReport(conflicts, List.of(
                MOVE_WITH_DEPENDENCIES,
                IGNORE_DEPENDENCIES,
                MOVE_DEPENDENCIES_FIRST,
                "Check the dependency graph: taskpilot deps validate"));
    }
}
