package com.taskpilot.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowMetricsTest {

    private SimpleMeterRegistry registry;
    private WorkflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WorkflowMetrics(registry);
    }

    @Test
    @DisplayName("recordWorkflowResult increments by outcome tag")
    void recordWorkflowResult() {
        metrics.recordWorkflowResult("started");
        metrics.recordWorkflowResult("started");
        metrics.recordWorkflowResult("completed");

        var started = registry.find("taskpilot.workflows.total").tag("outcome", "started").counter();
        var completed = registry.find("taskpilot.workflows.total").tag("outcome", "completed").counter();

        assertNotNull(started);
        assertNotNull(completed);
        assertEquals(2.0, started.count());
        assertEquals(1.0, completed.count());
    }

    @Test
    @DisplayName("recordPhaseCompletion separates auto-completed RED phases")
    void recordPhaseCompletion() {
        metrics.recordPhaseCompletion("RED", false);
        metrics.recordPhaseCompletion("RED", true);

        var manual = registry.find("taskpilot.phase.completions").tags("phase", "RED", "auto", "false").counter();
        var auto = registry.find("taskpilot.phase.completions").tags("phase", "RED", "auto", "true").counter();

        assertEquals(1.0, manual.count());
        assertEquals(1.0, auto.count());
    }

    @Test
    @DisplayName("recordValidationFailure tags phase and reason")
    void recordValidationFailure() {
        metrics.recordValidationFailure("GREEN", "coverage");

        var counter = registry.find("taskpilot.validation.failures")
                .tags("phase", "GREEN", "reason", "coverage").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordCommit counts and times commits")
    void recordCommit() {
        metrics.recordCommit(120);
        metrics.recordCommit(80);

        assertEquals(2.0, registry.find("taskpilot.commits.total").counter().count());
        var timer = registry.find("taskpilot.commit.duration").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }
}
