package com.taskpilot.core.dependency;

import java.util.List;

/**
 * Answer to "can this task move to the target group as-is?".
 *
 * @param canMove          true when there are no conflicts
 * @param conflicts        direct dependency conflicts
 * @param dependentTaskIds ids that would have to move along to resolve the conflicts
 */
public record MoveAssessment(
    boolean canMove,
    List<DependencyConflict> conflicts,
    List<String> dependentTaskIds
) {

    public MoveAssessment {
        conflicts = List.copyOf(conflicts);
        dependentTaskIds = List.copyOf(dependentTaskIds);
    }
}
