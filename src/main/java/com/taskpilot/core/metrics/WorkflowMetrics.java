package com.taskpilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for TDD workflow execution.
 */
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkflowResult(String outcome) {
        Counter.builder("taskpilot.workflows.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPhaseCompletion(String tddPhase, boolean autoCompleted) {
        Counter.builder("taskpilot.phase.completions")
                .tag("phase", tddPhase)
                .tag("auto", String.valueOf(autoCompleted))
                .register(registry)
                .increment();
    }

    /**
     * @param reason "validation" or "coverage"
     */
    public void recordValidationFailure(String tddPhase, String reason) {
        Counter.builder("taskpilot.validation.failures")
                .description("Test results rejected by phase validation")
                .tag("phase", tddPhase)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCommit(long ms) {
        Counter.builder("taskpilot.commits.total")
                .register(registry)
                .increment();
        Timer.builder("taskpilot.commit.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
