package com.taskpilot.core.config;

import com.taskpilot.core.commit.CommitMessageGenerator;
import com.taskpilot.core.commit.ScopeDetector;
import com.taskpilot.core.commit.TemplateEngine;
import com.taskpilot.core.dependency.DependencyGraphValidator;
import com.taskpilot.core.engine.WorkflowOptions;
import com.taskpilot.core.engine.WorkflowStateMachine;
import com.taskpilot.core.events.ActivityLogSubscriber;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.git.GitCliAdapter;
import com.taskpilot.core.git.VersionControlAdapter;
import com.taskpilot.core.metrics.WorkflowMetrics;
import com.taskpilot.core.persistence.ActivityLog;
import com.taskpilot.core.persistence.WorkflowStateStore;
import com.taskpilot.core.task.JsonFileTaskRepository;
import com.taskpilot.core.task.TaskRepository;
import com.taskpilot.core.validation.TestResultValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the workflow engine and its collaborators from {@link TaskpilotProperties}.
 */
@Configuration
public class WorkflowConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        return new WorkflowMetrics(meterRegistry);
    }

    @Bean
    public WorkflowStateStore workflowStateStore(TaskpilotProperties properties) {
        return new WorkflowStateStore(properties.resolveProjectRoot(), properties.resolveStateHome(),
                properties.getWorkflow().getMaxBackups());
    }

    @Bean
    public ActivityLog activityLog(WorkflowStateStore store) {
        return ActivityLog.forStore(store);
    }

    @Bean
    public EventBus eventBus(ActivityLog activityLog) {
        var eventBus = new EventBus();
        new ActivityLogSubscriber(activityLog).attach(eventBus);
        return eventBus;
    }

    @Bean
    public VersionControlAdapter versionControlAdapter(TaskpilotProperties properties) {
        return new GitCliAdapter(properties.resolveProjectRoot());
    }

    @Bean
    public TaskRepository taskRepository(TaskpilotProperties properties) {
        return new JsonFileTaskRepository(properties.resolveTasksFile(), properties.getTasks().getDefaultGroup());
    }

    @Bean
    public DependencyGraphValidator dependencyGraphValidator(TaskpilotProperties properties) {
        return new DependencyGraphValidator(properties.getDependencies().getMaxTraversalDepth());
    }

    @Bean
    public TemplateEngine templateEngine(TaskpilotProperties properties) {
        return new TemplateEngine(properties.getCommit().getTemplates(), false);
    }

    @Bean
    public CommitMessageGenerator commitMessageGenerator(TemplateEngine templateEngine,
                                                         TaskpilotProperties properties) {
        return new CommitMessageGenerator(templateEngine, new ScopeDetector(), properties.getCommit().getTemplate());
    }

    @Bean
    public WorkflowStateMachine workflowStateMachine(WorkflowStateStore store,
                                                     VersionControlAdapter versionControlAdapter,
                                                     TaskRepository taskRepository,
                                                     TestResultValidator testResultValidator,
                                                     CommitMessageGenerator commitMessageGenerator,
                                                     EventBus eventBus,
                                                     WorkflowMetrics workflowMetrics,
                                                     TaskpilotProperties properties) {
        return new WorkflowStateMachine(store, versionControlAdapter, taskRepository, testResultValidator,
                commitMessageGenerator, eventBus, workflowMetrics, WorkflowOptions.from(properties));
    }
}
