package com.taskpilot.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.core.model.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Persists the single workflow of a project outside the project tree, under
 * {@code <stateHome>/<projectKey>/sessions/workflow-state.json}.
 *
 * <p>Every write goes to a temp file in the same directory and is renamed over the target.
 * Before an existing state is replaced it is copied to {@code sessions/backups/}, keeping at
 * most {@code maxBackups} copies. Writers in this JVM are serialized per state file; separate
 * processes are not arbitrated beyond the atomic rename.
 */
public class WorkflowStateStore {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateStore.class);

    static final String STATE_FILE = "workflow-state.json";
    static final String BACKUP_PREFIX = "workflow-state-";
    static final String BACKUP_SUFFIX = ".json";

    private static final ConcurrentHashMap<Path, ReentrantLock> WRITE_LOCKS = new ConcurrentHashMap<>();
    private static final AtomicInteger BACKUP_SEQUENCE = new AtomicInteger();

    private final Path projectRoot;
    private final Path sessionDir;
    private final Path statePath;
    private final Path backupDir;
    private final int maxBackups;
    private final ObjectMapper objectMapper;

    public WorkflowStateStore(Path projectRoot, Path stateHome, int maxBackups) {
        this(projectRoot, stateHome, maxBackups, WorkflowJson.newObjectMapper());
    }

    public WorkflowStateStore(Path projectRoot, Path stateHome, int maxBackups, ObjectMapper objectMapper) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.sessionDir = stateHome.resolve(ProjectKeyCodec.encode(this.projectRoot)).resolve("sessions");
        this.statePath = sessionDir.resolve(STATE_FILE);
        this.backupDir = sessionDir.resolve("backups");
        this.maxBackups = Math.max(0, maxBackups);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public boolean exists() {
        return Files.isRegularFile(statePath);
    }

    /**
     * @throws WorkflowNotFoundException   when no state has been saved for the project
     * @throws WorkflowStateStoreException when the file cannot be read or parsed
     */
    public WorkflowState load() {
        try {
            return objectMapper.readValue(Files.readAllBytes(statePath), WorkflowState.class);
        } catch (NoSuchFileException e) {
            throw new WorkflowNotFoundException("No active workflow for project " + projectRoot);
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to load workflow state from " + statePath, e);
        }
    }

    /**
     * Backs up the current state (if any) and atomically replaces it with {@code state}.
     */
    public void save(WorkflowState state) {
        Objects.requireNonNull(state, "state");
        ReentrantLock lock = WRITE_LOCKS.computeIfAbsent(statePath, k -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(sessionDir);
            if (exists()) {
                backupCurrent();
            }
            AtomicFiles.write(statePath, objectMapper.writeValueAsBytes(state));
            log.debug("Saved workflow state for task {} (phase {})", state.context().taskId(), state.phase());
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to save workflow state to " + statePath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the state file. Succeeds when there is nothing to remove.
     */
    public void delete() {
        ReentrantLock lock = WRITE_LOCKS.computeIfAbsent(statePath, k -> new ReentrantLock());
        lock.lock();
        try {
            if (Files.deleteIfExists(statePath)) {
                log.info("Deleted workflow state {}", statePath);
            }
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to delete workflow state " + statePath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Backup file names, newest first.
     */
    public List<String> listBackups() {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(BACKUP_PREFIX) && n.endsWith(BACKUP_SUFFIX))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to list backups in " + backupDir, e);
        }
    }

    /**
     * Saves the state held in the named backup as the current state.
     */
    public WorkflowState restoreBackup(String backupFileName) {
        if (backupFileName == null || backupFileName.contains("/") || backupFileName.contains("\\")) {
            throw new IllegalArgumentException("Invalid backup file name: " + backupFileName);
        }
        Path backup = backupDir.resolve(backupFileName);
        WorkflowState state;
        try {
            JsonNode root = objectMapper.readTree(Files.readAllBytes(backup));
            state = objectMapper.treeToValue(root.get("state"), WorkflowState.class);
        } catch (IOException e) {
            throw new WorkflowStateStoreException("Failed to restore backup " + backup, e);
        }
        if (state == null) {
            throw new WorkflowStateStoreException("Backup " + backup + " holds no state");
        }
        save(state);
        log.info("Restored workflow state from backup {}", backupFileName);
        return state;
    }

    public Path statePath() {
        return statePath;
    }

    public Path sessionDir() {
        return sessionDir;
    }

    public Path backupDir() {
        return backupDir;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    private void backupCurrent() throws IOException {
        if (maxBackups == 0) {
            return;
        }
        JsonNode current;
        try {
            current = objectMapper.readTree(Files.readAllBytes(statePath));
        } catch (IOException e) {
            log.warn("Current workflow state is unreadable, overwriting without backup: {}", e.getMessage());
            return;
        }
        Files.createDirectories(backupDir);
        ObjectNode backup = objectMapper.createObjectNode();
        backup.put("timestamp", Instant.now().toString());
        backup.set("state", current);

        String name = "%s%013d-%04d%s".formatted(BACKUP_PREFIX, System.currentTimeMillis(),
                BACKUP_SEQUENCE.getAndIncrement() % 10_000, BACKUP_SUFFIX);
        AtomicFiles.write(backupDir.resolve(name), objectMapper.writeValueAsBytes(backup));
        pruneBackups();
    }

    private void pruneBackups() throws IOException {
        List<String> backups = listBackups();
        for (String stale : backups.subList(Math.min(maxBackups, backups.size()), backups.size())) {
            Files.deleteIfExists(backupDir.resolve(stale));
            log.debug("Pruned backup {}", stale);
        }
    }
}
