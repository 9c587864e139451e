package com.taskpilot.core.dependency;

import com.taskpilot.core.model.Subtask;
import com.taskpilot.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed dependency graph over tasks ("3") and subtasks ("3.1").
 *
 * <p>Subtask dependencies without a dot refer to a sibling when one with that id exists,
 * otherwise to a top-level task. All traversals are iterative with an explicit stack whose
 * depth is bounded by {@code maxDepth}.
 */
final class DependencyGraph {

    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final int maxDepth;

    private DependencyGraph(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    static DependencyGraph of(List<Task> tasks, int maxDepth) {
        var graph = new DependencyGraph(maxDepth);
        for (Task task : tasks) {
            graph.edgesOf(task.id()).addAll(task.dependencies());
            for (Subtask subtask : task.subtasks()) {
                String fullId = subtaskId(task.id(), subtask.id());
                var out = graph.edgesOf(fullId);
                for (String dep : subtask.dependencies()) {
                    out.add(normalizeSubtaskDependency(task, dep));
                }
            }
        }
        return graph;
    }

    static String subtaskId(String parentId, String subtaskId) {
        return subtaskId.contains(".") ? subtaskId : parentId + "." + subtaskId;
    }

    static String normalizeSubtaskDependency(Task parent, String dep) {
        if (dep.contains(".")) {
            return dep;
        }
        boolean sibling = parent.subtasks().stream().anyMatch(s -> s.id().equals(dep));
        return sibling ? parent.id() + "." + dep : dep;
    }

    boolean contains(String id) {
        return edges.containsKey(id);
    }

    List<String> successors(String id) {
        return edges.getOrDefault(id, List.of());
    }

    /**
     * Finds any cycle in the graph, visiting nodes in insertion order.
     *
     * @return the cycle path with the first id repeated at the end, or empty if acyclic
     */
    Optional<List<String>> findCycle() {
        var state = new HashMap<String, Boolean>(); // false = on stack, true = finished
        for (String root : edges.keySet()) {
            if (state.containsKey(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            push(stack, root);
            state.put(root, false);
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next < top.successors.size()) {
                    String succ = top.successors.get(top.next++);
                    Boolean seen = state.get(succ);
                    if (seen == null) {
                        state.put(succ, false);
                        push(stack, succ);
                    } else if (!seen) {
                        return Optional.of(cycleFrom(stack, succ));
                    }
                } else {
                    stack.pop();
                    state.put(top.node, true);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Depth-first search for a path of at least one edge from {@code from} to {@code to}.
     */
    Optional<List<String>> findPath(String from, String to) {
        Set<String> visited = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        push(stack, from);
        visited.add(from);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next >= top.successors.size()) {
                stack.pop();
                continue;
            }
            String succ = top.successors.get(top.next++);
            if (succ.equals(to)) {
                List<String> path = pathOf(stack);
                path.add(to);
                return Optional.of(path);
            }
            if (visited.add(succ)) {
                push(stack, succ);
            }
        }
        return Optional.empty();
    }

    private void push(Deque<Frame> stack, String node) {
        if (stack.size() >= maxDepth) {
            throw new IllegalStateException(
                    "Dependency traversal exceeded maximum depth of " + maxDepth + " at " + node);
        }
        stack.push(new Frame(node, successors(node)));
    }

    private List<String> edgesOf(String id) {
        return edges.computeIfAbsent(id, k -> new ArrayList<>());
    }

    private static List<String> pathOf(Deque<Frame> stack) {
        var path = new ArrayList<String>(stack.size() + 1);
        var it = stack.descendingIterator();
        while (it.hasNext()) {
            path.add(it.next().node);
        }
        return path;
    }

    private static List<String> cycleFrom(Deque<Frame> stack, String start) {
        List<String> path = pathOf(stack);
        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(start), path.size()));
        cycle.add(start);
        return cycle;
    }

    private static final class Frame {
        final String node;
        final List<String> successors;
        int next;

        Frame(String node, List<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
