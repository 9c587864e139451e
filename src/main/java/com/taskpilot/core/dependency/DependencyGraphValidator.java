package com.taskpilot.core.dependency;

import com.taskpilot.core.model.Subtask;
import com.taskpilot.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cycle detection and cross-group move analysis over the task dependency graph.
 *
 * <p>Cross-group checks are one hop: only the direct dependencies of the tasks being moved
 * are inspected. Each group numbers its tasks independently, so a dependency is resolved in
 * the dependent task's own group first and in other groups only when it is absent there. It
 * is a conflict when that owning task is not in the target group. A subtask reference such as
 * {@code "3.1"} is owned by task {@code 3}. Dependencies that resolve to no task are left to
 * {@link #validateTaskDependencies}.
 *
 * <p>This validator never moves anything. It reports conflicts and the available remediations;
 * the caller chooses one through {@link MoveOptions}.
 */
public class DependencyGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphValidator.class);

    public static final int DEFAULT_MAX_TRAVERSAL_DEPTH = 10_000;

    private final int maxTraversalDepth;

    public DependencyGraphValidator() {
        this(DEFAULT_MAX_TRAVERSAL_DEPTH);
    }

    /**
     * @param maxTraversalDepth bound on the explicit DFS stack; exceeding it fails the traversal
     */
    public DependencyGraphValidator(int maxTraversalDepth) {
        if (maxTraversalDepth < 1) {
            throw new IllegalArgumentException("maxTraversalDepth must be positive");
        }
        this.maxTraversalDepth = maxTraversalDepth;
    }

    public int maxTraversalDepth() {
        return maxTraversalDepth;
    }

    // --- cross-group moves ---

    /**
     * Direct dependencies of {@code movingTasks} whose owner is not in {@code targetGroup}.
     */
    public List<DependencyConflict> findCrossTagDependencies(List<Task> movingTasks, String sourceGroup,
                                                             String targetGroup, List<Task> allTasks) {
        Objects.requireNonNull(movingTasks, "movingTasks");
        Objects.requireNonNull(allTasks, "allTasks");
        requireGroup(sourceGroup, "Source group");
        requireGroup(targetGroup, "Target group");

        var conflicts = new ArrayList<DependencyConflict>();
        for (Task task : movingTasks) {
            if (task == null) {
                continue;
            }
            for (String dep : task.dependencies()) {
                if (dep == null || dep.isBlank()) {
                    continue;
                }
                Task owner = resolveOwner(dep, task.group() == null ? sourceGroup : task.group(), allTasks);
                if (owner == null) {
                    log.debug("Dependency {} of task {} resolves to no task, skipping", dep, task.id());
                    continue;
                }
                if (!targetGroup.equals(owner.group())) {
                    conflicts.add(new DependencyConflict(task.id(), dep, owner.group()));
                }
            }
        }
        log.debug("findCrossTagDependencies: {} task(s) {} -> {}: {} conflict(s)",
                movingTasks.size(), sourceGroup, targetGroup, conflicts.size());
        return conflicts;
    }

    /**
     * Distinct owning task ids blocking a move, excluding tasks that are already moving.
     */
    public List<String> getDependentTaskIds(List<Task> movingTasks, List<DependencyConflict> conflicts,
                                            List<Task> allTasks) {
        Objects.requireNonNull(movingTasks, "movingTasks");
        Objects.requireNonNull(conflicts, "conflicts");
        Set<String> moving = new LinkedHashSet<>();
        for (Task task : movingTasks) {
            moving.add(task.id());
        }

        Set<String> ids = new LinkedHashSet<>();
        for (DependencyConflict conflict : conflicts) {
            Task owner = resolveOwner(conflict.dependencyId(), conflict.dependencyGroup(), allTasks);
            String id = owner != null ? owner.id() : conflict.dependencyId();
            if (!moving.contains(id)) {
                ids.add(id);
            }
        }
        return List.copyOf(ids);
    }

    /**
     * Checks whether a task in {@code sourceGroup} can move to {@code targetGroup} without
     * breaking any of its direct dependencies.
     *
     * @throws IllegalArgumentException if no such task exists in the source group
     */
    public MoveAssessment canMoveWithDependencies(String taskId, String sourceGroup, String targetGroup,
                                                  List<Task> allTasks) {
        validateSubtaskMove(taskId);
        Task task = findInGroup(taskId, sourceGroup, allTasks)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Task %s not found in group '%s'".formatted(taskId, sourceGroup)));

        List<DependencyConflict> conflicts =
                findCrossTagDependencies(List.of(task), sourceGroup, targetGroup, allTasks);
        if (conflicts.isEmpty()) {
            return new MoveAssessment(true, List.of(), List.of());
        }
        return new MoveAssessment(false, conflicts, getDependentTaskIds(List.of(task), conflicts, allTasks));
    }

    /**
     * Validates a cross-group move and, when conflicts exist, applies the caller's chosen resolution.
     *
     * @throws IllegalArgumentException               for a subtask id, equal groups or both flags set
     * @throws CrossGroupDependencyConflictException  when conflicts exist and no flag is set
     */
    public MoveValidationResult validateCrossTagMove(Task task, String sourceGroup, String targetGroup,
                                                     List<Task> allTasks, MoveOptions options) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(allTasks, "allTasks");
        validateSubtaskMove(task.id());
        requireGroup(sourceGroup, "Source group");
        requireGroup(targetGroup, "Target group");
        MoveOptions opts = options == null ? MoveOptions.none() : options;

        if (opts.withDependencies() && opts.ignoreDependencies()) {
            throw new IllegalArgumentException(
                    "Cannot combine 'with dependencies' and 'ignore dependencies'; choose one resolution");
        }
        if (sourceGroup.equals(targetGroup)) {
            throw new IllegalArgumentException("Source and target groups are the same: " + sourceGroup);
        }

        List<DependencyConflict> conflicts =
                findCrossTagDependencies(List.of(task), sourceGroup, targetGroup, allTasks);
        if (conflicts.isEmpty()) {
            return new MoveValidationResult(task.id(), List.of(), List.of(task.id()), MoveResolution.NONE);
        }

        if (opts.withDependencies()) {
            var toMove = new ArrayList<String>();
            toMove.add(task.id());
            for (Task dependency : dependencyClosure(List.of(task), sourceGroup, allTasks)) {
                if (sourceGroup.equals(dependency.group()) && !toMove.contains(dependency.id())) {
                    toMove.add(dependency.id());
                }
            }
            log.info("Moving task {} with {} dependenc(ies) from '{}' to '{}'",
                    task.id(), toMove.size() - 1, sourceGroup, targetGroup);
            return new MoveValidationResult(task.id(), conflicts, toMove, MoveResolution.WITH_DEPENDENCIES);
        }
        if (opts.ignoreDependencies()) {
            log.warn("Moving task {} to '{}' severs {} dependency conflict(s)",
                    task.id(), targetGroup, conflicts.size());
            return new MoveValidationResult(task.id(), conflicts, List.of(task.id()),
                    MoveResolution.IGNORE_DEPENDENCIES);
        }
        throw new CrossGroupDependencyConflictException(task.id(), targetGroup,
                DependencyConflictReport.of(conflicts));
    }

    /**
     * Forward dependency closure of {@code sourceTasks} at task granularity, excluding the
     * sources themselves. Expansion stops at the traversal depth bound.
     */
    public List<String> findAllDependenciesRecursively(List<Task> sourceTasks, List<Task> allTasks) {
        Objects.requireNonNull(sourceTasks, "sourceTasks");
        Objects.requireNonNull(allTasks, "allTasks");
        Set<String> ids = new LinkedHashSet<>();
        for (Task dependency : dependencyClosure(sourceTasks, null, allTasks)) {
            ids.add(dependency.id());
        }
        return List.copyOf(ids);
    }

    /**
     * Breadth-first closure over resolved owner tasks. Tasks are identified by group and id,
     * so equal ids in different groups stay distinct.
     */
    private List<Task> dependencyClosure(List<Task> sourceTasks, String defaultGroup, List<Task> allTasks) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<Task> frontier = new ArrayDeque<>();
        for (Task task : sourceTasks) {
            visited.add(keyOf(task));
            frontier.add(task);
        }

        var found = new ArrayList<Task>();
        int depth = 0;
        while (!frontier.isEmpty()) {
            if (depth >= maxTraversalDepth) {
                log.warn("Dependency closure truncated at depth {}", maxTraversalDepth);
                break;
            }
            Deque<Task> next = new ArrayDeque<>();
            for (Task task : frontier) {
                String group = task.group() == null ? defaultGroup : task.group();
                for (String dep : task.dependencies()) {
                    Task owner = resolveOwner(dep, group, allTasks);
                    if (owner != null && visited.add(keyOf(owner))) {
                        found.add(owner);
                        next.add(owner);
                    }
                }
            }
            frontier = next;
            depth++;
        }
        return found;
    }

    /**
     * Rejects direct moves of subtasks; they must be promoted to tasks first.
     */
    public void validateSubtaskMove(String taskId) {
        requireTaskId(taskId);
        if (taskId.contains(".")) {
            throw new IllegalArgumentException(
                    "Cannot move subtask %s directly between groups; promote it to a task first".formatted(taskId));
        }
    }

    // --- cycles ---

    /**
     * Finds a dependency cycle among {@code tasks} (and their subtasks).
     *
     * @return the cycle path, e.g. {@code [1, 2, 3, 1]}, or empty when the graph is acyclic
     * @throws IllegalStateException when the traversal exceeds the depth bound
     */
    public Optional<List<String>> findCycle(List<Task> tasks) {
        return DependencyGraph.of(tasks, maxTraversalDepth).findCycle();
    }

    /**
     * @throws CycleDetectedException with the full cycle path when one exists
     */
    public void assertAcyclic(List<Task> tasks) {
        Optional<List<String>> cycle = findCycle(tasks);
        if (cycle.isPresent()) {
            throw new CycleDetectedException(cycle.get());
        }
    }

    /**
     * Whether adding {@code taskId -> newDependencyId} would close a cycle.
     */
    public boolean wouldCreateCycle(List<Task> tasks, String taskId, String newDependencyId) {
        return cycleIfAdded(tasks, taskId, newDependencyId).isPresent();
    }

    /**
     * The cycle that adding {@code taskId -> newDependencyId} would close, if any.
     */
    public Optional<List<String>> cycleIfAdded(List<Task> tasks, String taskId, String newDependencyId) {
        requireTaskId(taskId);
        requireTaskId(newDependencyId);
        if (taskId.equals(newDependencyId)) {
            return Optional.of(List.of(taskId, taskId));
        }
        return DependencyGraph.of(tasks, maxTraversalDepth)
                .findPath(newDependencyId, taskId)
                .map(path -> {
                    var cycle = new ArrayList<String>(path.size() + 1);
                    cycle.add(taskId);
                    cycle.addAll(path);
                    return cycle;
                });
    }

    /**
     * Reports self, missing and circular dependencies for tasks and their subtasks.
     */
    public DependencyValidationResult validateTaskDependencies(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        DependencyGraph graph = DependencyGraph.of(tasks, maxTraversalDepth);
        var issues = new ArrayList<DependencyIssue>();

        for (Task task : tasks) {
            checkNode("Task", task.id(), task.dependencies(), graph, issues);
            for (Subtask subtask : task.subtasks()) {
                String fullId = DependencyGraph.subtaskId(task.id(), subtask.id());
                List<String> deps = subtask.dependencies().stream()
                        .map(dep -> DependencyGraph.normalizeSubtaskDependency(task, dep))
                        .toList();
                checkNode("Subtask", fullId, deps, graph, issues);
            }
        }
        return new DependencyValidationResult(issues.isEmpty(), issues);
    }

    private void checkNode(String label, String id, List<String> deps, DependencyGraph graph,
                           List<DependencyIssue> issues) {
        boolean selfReference = false;
        for (String dep : deps) {
            if (dep.equals(id)) {
                selfReference = true;
                issues.add(new DependencyIssue(DependencyIssue.Type.SELF, id, dep,
                        "%s %s depends on itself".formatted(label, id)));
            } else if (!graph.contains(dep)) {
                issues.add(new DependencyIssue(DependencyIssue.Type.MISSING, id, dep,
                        "%s %s depends on non-existent task %s".formatted(label, id, dep)));
            }
        }
        if (selfReference) {
            return;
        }
        graph.findPath(id, id).ifPresent(path -> issues.add(new DependencyIssue(
                DependencyIssue.Type.CIRCULAR, id, null,
                "%s %s is part of a circular dependency chain: %s".formatted(
                        label, id, String.join(" -> ", path)))));
    }

    // --- helpers ---

    /**
     * The task that owns {@code dependencyId}: the task itself, or the parent of a
     * {@code "parent.sub"} reference. Tasks in {@code preferredGroup} win over equal ids
     * elsewhere. Null when nothing owns it.
     */
    static Task resolveOwner(String dependencyId, String preferredGroup, List<Task> allTasks) {
        if (dependencyId == null) {
            return null;
        }
        Task fallback = null;
        for (Task task : allTasks) {
            if (owns(task, dependencyId)) {
                if (Objects.equals(task.group(), preferredGroup)) {
                    return task;
                }
                if (fallback == null) {
                    fallback = task;
                }
            }
        }
        return fallback;
    }

    private static boolean owns(Task task, String dependencyId) {
        if (task.id().equals(dependencyId)) {
            return true;
        }
        int dot = dependencyId.indexOf('.');
        if (dot <= 0 || !task.id().equals(dependencyId.substring(0, dot))) {
            return false;
        }
        String subId = dependencyId.substring(dot + 1);
        return task.subtasks().stream().anyMatch(s -> s.id().equals(subId) || s.id().equals(dependencyId));
    }

    private static String keyOf(Task task) {
        return task.group() + "/" + task.id();
    }

    private static Optional<Task> findInGroup(String taskId, String group, List<Task> allTasks) {
        return allTasks.stream()
                .filter(t -> t.id().equals(taskId) && Objects.equals(group, t.group()))
                .findFirst();
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID must be a non-blank string");
        }
    }

    private static void requireGroup(String group, String label) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException(label + " must be a non-blank string");
        }
    }
}
