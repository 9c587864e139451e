package com.taskpilot.core.dependency;

import com.taskpilot.core.exception.ErrorKind;
import com.taskpilot.core.exception.WorkflowException;

import java.util.List;

/**
 * Thrown when a dependency cycle exists or a mutation would introduce one.
 */
public class CycleDetectedException extends WorkflowException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super(ErrorKind.CYCLE_DETECTED,
                "Circular dependency detected: " + String.join(" -> ", cycle),
                List.of("Remove one of the dependencies in the cycle"));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * The cycle path; first and last elements are the same id.
     */
    public List<String> cycle() {
        return cycle;
    }
}
