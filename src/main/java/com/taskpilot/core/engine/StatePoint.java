package com.taskpilot.core.engine;

import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowState;

import java.util.ArrayList;
import java.util.List;

/**
 * A position in the workflow: the phase plus, inside the subtask loop, the TDD step.
 */
public record StatePoint(WorkflowPhase phase, TddPhase tddPhase) {

    public StatePoint {
        if (phase == null) {
            throw new IllegalArgumentException("phase is required");
        }
        if ((phase == WorkflowPhase.SUBTASK_LOOP) != (tddPhase != null)) {
            throw new IllegalArgumentException(
                    "TDD phase must be set inside SUBTASK_LOOP and only there: " + phase + "/" + tddPhase);
        }
    }

    public static StatePoint of(WorkflowPhase phase) {
        return new StatePoint(phase, null);
    }

    public static StatePoint loop(TddPhase tddPhase) {
        return new StatePoint(WorkflowPhase.SUBTASK_LOOP, tddPhase);
    }

    public static StatePoint of(WorkflowState state) {
        return new StatePoint(state.phase(), state.tddPhase());
    }

    /**
     * Every valid point, in workflow order.
     */
    public static List<StatePoint> all() {
        var points = new ArrayList<StatePoint>();
        for (WorkflowPhase phase : WorkflowPhase.values()) {
            if (phase == WorkflowPhase.SUBTASK_LOOP) {
                for (TddPhase tdd : TddPhase.values()) {
                    points.add(loop(tdd));
                }
            } else {
                points.add(of(phase));
            }
        }
        return List.copyOf(points);
    }

    @Override
    public String toString() {
        return tddPhase == null ? phase.name() : phase.name() + "/" + tddPhase.name();
    }
}
