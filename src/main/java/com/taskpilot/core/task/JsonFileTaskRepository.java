package com.taskpilot.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.core.model.Subtask;
import com.taskpilot.core.model.Task;
import com.taskpilot.core.persistence.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads tasks from a tagged {@code tasks.json}:
 * <pre>
 * { "master": { "tasks": [ { "id": 1, "title": "...", "status": "pending",
 *                             "dependencies": [2, "3.1"], "subtasks": [ ... ] } ] },
 *   "backlog": { "tasks": [ ... ] } }
 * </pre>
 * A legacy file with a top-level {@code "tasks"} array is read as the default group.
 * Ids may be numbers or strings and are always exposed as strings. Unknown fields are
 * preserved when the file is rewritten.
 */
public class JsonFileTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskRepository.class);

    private final Path file;
    private final String defaultGroup;
    private final ObjectMapper objectMapper;

    public JsonFileTaskRepository(Path file, String defaultGroup) {
        this.file = file;
        this.defaultGroup = defaultGroup;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<Task> listTasks(String group) {
        JsonNode tasks = tasksNode(readRoot(), group);
        return tasks == null ? List.of() : toTasks(tasks, group);
    }

    @Override
    public List<Task> listAllTasks() {
        JsonNode root = readRoot();
        var all = new ArrayList<Task>();
        for (String group : groups(root)) {
            JsonNode tasks = tasksNode(root, group);
            if (tasks != null) {
                all.addAll(toTasks(tasks, group));
            }
        }
        return all;
    }

    @Override
    public Optional<Task> findTask(String taskId, String group) {
        return listTasks(group).stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    @Override
    public synchronized void markDone(String taskId, String group) {
        JsonNode root = readRoot();
        JsonNode tasks = tasksNode(root, group);
        if (tasks == null) {
            throw new TaskNotFoundException(taskId, group);
        }
        ObjectNode target = null;
        for (JsonNode task : tasks) {
            if (taskId.equals(task.path("id").asText())) {
                target = (ObjectNode) task;
                break;
            }
        }
        if (target == null) {
            throw new TaskNotFoundException(taskId, group);
        }
        target.put("status", "done");
        try {
            AtomicFiles.write(file, objectMapper.writeValueAsBytes(root));
        } catch (IOException e) {
            throw new TaskRepositoryException("Failed to update " + file, e);
        }
        log.info("Marked task {} done in group '{}'", taskId, group);
    }

    public Path file() {
        return file;
    }

    private JsonNode readRoot() {
        if (!Files.exists(file)) {
            log.debug("Task file {} does not exist", file);
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new TaskRepositoryException("Failed to read " + file, e);
        }
    }

    private List<String> groups(JsonNode root) {
        if (root.path("tasks").isArray()) {
            return List.of(defaultGroup);
        }
        var groups = new ArrayList<String>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (entry.getValue().path("tasks").isArray()) {
                groups.add(entry.getKey());
            }
        }
        return groups;
    }

    private JsonNode tasksNode(JsonNode root, String group) {
        if (root.path("tasks").isArray()) {
            return group.equals(defaultGroup) ? root.get("tasks") : null;
        }
        JsonNode tasks = root.path(group).path("tasks");
        return tasks.isArray() ? tasks : null;
    }

    private static List<Task> toTasks(JsonNode tasks, String group) {
        var out = new ArrayList<Task>();
        for (JsonNode node : (ArrayNode) tasks) {
            var subtasks = new ArrayList<Subtask>();
            for (JsonNode sub : node.path("subtasks")) {
                subtasks.add(new Subtask(
                        sub.path("id").asText(),
                        sub.path("title").asText(""),
                        sub.path("status").asText("pending"),
                        ids(sub.path("dependencies"))));
            }
            out.add(new Task(
                    node.path("id").asText(),
                    node.path("title").asText(""),
                    node.path("status").asText("pending"),
                    ids(node.path("dependencies")),
                    group,
                    subtasks));
        }
        return out;
    }

    private static List<String> ids(JsonNode array) {
        var ids = new ArrayList<String>();
        for (JsonNode id : array) {
            if (!id.isNull()) {
                ids.add(id.asText());
            }
        }
        return ids;
    }
}
