package com.taskpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted by the workflow engine, consumed by the activity log and any other subscriber.
 *
 * @param type      what happened
 * @param taskId    the task whose workflow emitted the event
 * @param subtaskId the subtask involved (nullable for workflow-level events)
 * @param payload   event-specific values
 * @param timestamp when the event occurred
 */
public record WorkflowEvent(
    WorkflowEventType type,
    String taskId,
    String subtaskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public WorkflowEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static WorkflowEvent of(WorkflowEventType type, String taskId, String subtaskId,
                                   Map<String, Object> payload) {
        return new WorkflowEvent(type, taskId, subtaskId, payload, Instant.now());
    }
}
