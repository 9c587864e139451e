package com.taskpilot.core.dependency;

import java.util.List;

/**
 * An accepted cross-group move.
 *
 * @param taskId      the task requested to move
 * @param conflicts   conflicts found, already resolved by {@code resolution}
 * @param tasksToMove ids to relocate, the requested task first
 * @param resolution  how the conflicts were resolved
 */
public record MoveValidationResult(
    String taskId,
    List<DependencyConflict> conflicts,
    List<String> tasksToMove,
    MoveResolution resolution
) {

    public MoveValidationResult {
        conflicts = List.copyOf(conflicts);
        tasksToMove = List.copyOf(tasksToMove);
    }
}
