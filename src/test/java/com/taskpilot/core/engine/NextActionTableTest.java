package com.taskpilot.core.engine;

import com.taskpilot.core.model.SubtaskInfo;
import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.WorkflowContext;
import com.taskpilot.core.model.WorkflowPhase;
import com.taskpilot.core.model.WorkflowState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NextActionTableTest {

    private final NextActionTable table = NextActionTable.standard();

    private static WorkflowState stateAt(WorkflowPhase phase, TddPhase tdd) {
        var ctx = WorkflowContext.initial("9",
                List.of(SubtaskInfo.pending("9.1", "Add parser", 3)), 0, Map.of())
                .withTddPhase(tdd);
        return new WorkflowState(phase, ctx);
    }

    @Test
    @DisplayName("covers every state point")
    void coversEveryPoint() {
        for (StatePoint point : StatePoint.all()) {
            assertTrue(table.covers(point), "missing " + point);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "PREFLIGHT,,resume_setup",
            "BRANCH_SETUP,,resume_setup",
            "SUBTASK_LOOP,RED,generate_test",
            "SUBTASK_LOOP,GREEN,implement_code",
            "SUBTASK_LOOP,COMMIT,commit_changes",
            "FINALIZE,,finalize_workflow",
            "COMPLETE,,workflow_complete"
    })
    @DisplayName("maps each point to its action")
    void actionPerPoint(WorkflowPhase phase, TddPhase tdd, String action) {
        var next = table.lookup(stateAt(phase, tdd));

        assertEquals(action, next.action());
        assertEquals(phase, next.phase());
        assertFalse(next.nextSteps().isEmpty());
    }

    @Test
    @DisplayName("substitutes the current subtask into the steps")
    void substitutesSubtask() {
        var next = table.lookup(stateAt(WorkflowPhase.SUBTASK_LOOP, TddPhase.GREEN));

        assertEquals("9.1", next.subtaskId());
        assertEquals("Add parser", next.subtaskTitle());
        assertEquals("Implement code to make tests pass for subtask 9.1: \"Add parser\".", next.nextSteps().get(0));
    }

    @Test
    @DisplayName("outside the loop no subtask is reported")
    void noSubtaskOutsideLoop() {
        var next = table.lookup(stateAt(WorkflowPhase.BRANCH_SETUP, null));

        assertNull(next.subtaskId());
        assertTrue(next.nextSteps().get(0).contains("taskpilot autopilot start 9"));
    }
}
