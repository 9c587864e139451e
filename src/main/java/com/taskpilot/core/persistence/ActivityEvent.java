package com.taskpilot.core.persistence;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of the activity log.
 *
 * @param timestamp when the event was recorded
 * @param type      event type, e.g. {@code "tdd:red:completed"}
 * @param fields    event-specific fields, written alongside timestamp and type
 */
public record ActivityEvent(Instant timestamp, String type, Map<String, Object> fields) {

    public ActivityEvent {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
