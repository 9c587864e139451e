package com.taskpilot.core.events;

import com.taskpilot.core.persistence.ActivityEvent;
import com.taskpilot.core.persistence.ActivityLog;

import java.util.LinkedHashMap;
import java.util.function.Consumer;

/**
 * Writes every published workflow event to the activity log. Write failures surface as
 * warnings from {@link EventBus} and never interrupt the workflow.
 */
public class ActivityLogSubscriber implements Consumer<WorkflowEvent> {

    private final ActivityLog activityLog;

    public ActivityLogSubscriber(ActivityLog activityLog) {
        this.activityLog = activityLog;
    }

    public EventBus.Subscription attach(EventBus eventBus) {
        return eventBus.subscribeAll(this);
    }

    @Override
    public void accept(WorkflowEvent event) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("taskId", event.taskId());
        if (event.subtaskId() != null) {
            fields.put("subtaskId", event.subtaskId());
        }
        fields.putAll(event.payload());
        activityLog.append(new ActivityEvent(event.timestamp(), event.type().value(), fields));
    }
}
