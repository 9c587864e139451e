package com.taskpilot.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only newline-delimited JSON audit trail. Existing lines are never rewritten.
 */
public class ActivityLog {

    private static final Logger log = LoggerFactory.getLogger(ActivityLog.class);

    public static final String FILE_NAME = "activity.jsonl";

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public ActivityLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public static ActivityLog forStore(WorkflowStateStore store) {
        return new ActivityLog(store.sessionDir().resolve(FILE_NAME), WorkflowJson.newObjectMapper());
    }

    public synchronized void append(ActivityEvent event) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put("timestamp", event.timestamp().toString());
        line.put("type", event.type());
        event.fields().forEach((k, v) -> {
            if (!"timestamp".equals(k) && !"type".equals(k)) {
                line.set(k, objectMapper.valueToTree(v));
            }
        });
        try {
            Files.createDirectories(file.getParent());
            // compact single-line form regardless of the mapper's indentation setting
            Files.writeString(file, line.toString() + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to append to activity log " + file, e);
        }
        log.trace("Activity logged: {}", event.type());
    }

    public void append(String type, Map<String, Object> fields) {
        append(new ActivityEvent(Instant.now(), type, fields));
    }

    /**
     * All events, oldest first. A missing log reads as empty.
     *
     * @throws WorkflowStateStoreException when a line is not valid JSON
     */
    public List<ActivityEvent> read() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to read activity log " + file, e);
        }

        var events = new ArrayList<ActivityEvent>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String raw = lines.get(i).trim();
            if (raw.isEmpty()) {
                continue;
            }
            try {
                events.add(toEvent(objectMapper.readTree(raw)));
            } catch (IOException | RuntimeException e) {
                throw new WorkflowStateStoreException("Invalid JSON at line " + (i + 1) + " of " + file, e);
            }
        }
        return events;
    }

    /**
     * Events matching every non-null criterion; bounds are inclusive.
     */
    public List<ActivityEvent> filter(String type, Instant from, Instant to) {
        return read().stream()
                .filter(e -> type == null || type.equals(e.type()))
                .filter(e -> from == null || !e.timestamp().isBefore(from))
                .filter(e -> to == null || !e.timestamp().isAfter(to))
                .toList();
    }

    public Path file() {
        return file;
    }

    private ActivityEvent toEvent(JsonNode node) {
        Map<String, Object> fields = objectMapper.convertValue(node, FIELDS);
        fields.remove("timestamp");
        fields.remove("type");
        return new ActivityEvent(Instant.parse(node.path("timestamp").asText()),
                node.path("type").asText(), fields);
    }
}
