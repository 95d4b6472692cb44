package com.agentweave.workflow.graph;

import com.agentweave.workflow.error.DecompositionException;
import com.agentweave.workflow.model.SubTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated dependency graph of one decomposition.
 * <p>
 * Single responsibility: reject malformed decompositions (duplicate ids, unknown or self
 * dependencies, cycles) before anything is dispatched, and expose declaration order for the
 * scheduler. Built only through {@link #of(List)}; an instance is always a DAG.
 */
public final class WorkflowGraph {

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    private final List<SubTask> subtasks;
    private final Map<String, Integer> indexById;
    private final Map<String, List<String>> dependents;

    private WorkflowGraph(List<SubTask> subtasks, Map<String, Integer> indexById, Map<String, List<String>> dependents) {
        this.subtasks = subtasks;
        this.indexById = indexById;
        this.dependents = dependents;
    }

    /**
     * Validates the decomposition and builds the graph.
     *
     * @throws DecompositionException on an empty list, duplicate id, unknown dependency,
     *                                self-dependency or cycle
     */
    public static WorkflowGraph of(List<SubTask> subtasks) {
        if (subtasks == null || subtasks.isEmpty()) {
            throw new DecompositionException("Decomposition produced no subtasks");
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < subtasks.size(); i++) {
            SubTask t = subtasks.get(i);
            if (t == null) throw new DecompositionException("Decomposition contains a null subtask at position " + i);
            if (index.putIfAbsent(t.getId(), i) != null) {
                throw new DecompositionException("Duplicate subtask id: " + t.getId());
            }
        }
        Map<String, List<String>> dependents = new HashMap<>();
        for (SubTask t : subtasks) {
            for (String dep : t.getDependencies()) {
                if (dep.equals(t.getId())) {
                    throw new DecompositionException("Subtask " + t.getId() + " depends on itself");
                }
                if (!index.containsKey(dep)) {
                    throw new DecompositionException("Subtask " + t.getId() + " depends on unknown subtask " + dep);
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(t.getId());
            }
        }
        List<SubTask> ordered = List.copyOf(subtasks);
        detectCycle(ordered, index);
        Map<String, List<String>> frozen = new HashMap<>();
        dependents.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new WorkflowGraph(ordered, Collections.unmodifiableMap(index), Collections.unmodifiableMap(frozen));
    }

    /** Iterative three-colour DFS over dependency edges; a grey-to-grey edge closes a cycle. */
    private static void detectCycle(List<SubTask> subtasks, Map<String, Integer> index) {
        int[] colour = new int[subtasks.size()];
        int[] parent = new int[subtasks.size()];
        for (int root = 0; root < subtasks.size(); root++) {
            if (colour[root] != WHITE) continue;
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            Deque<Integer> path = new ArrayDeque<>();
            colour[root] = GREY;
            parent[root] = -1;
            stack.push(subtasks.get(root).getDependencies().iterator());
            path.push(root);
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                int current = path.peek();
                if (it.hasNext()) {
                    int next = index.get(it.next());
                    if (colour[next] == GREY) {
                        throw new DecompositionException("Cyclic dependency: " + describeCycle(subtasks, parent, current, next));
                    }
                    if (colour[next] == WHITE) {
                        colour[next] = GREY;
                        parent[next] = current;
                        stack.push(subtasks.get(next).getDependencies().iterator());
                        path.push(next);
                    }
                } else {
                    colour[current] = BLACK;
                    stack.pop();
                    path.pop();
                }
            }
        }
    }

    private static String describeCycle(List<SubTask> subtasks, int[] parent, int from, int to) {
        List<String> ids = new ArrayList<>();
        for (int i = from; i != to && i != -1; i = parent[i]) {
            ids.add(subtasks.get(i).getId());
        }
        ids.add(subtasks.get(to).getId());
        Collections.reverse(ids);
        ids.add(subtasks.get(to).getId());
        return String.join(" -> ", ids);
    }

    /** Subtasks in declaration order. */
    public List<SubTask> getSubtasks() {
        return subtasks;
    }

    public int size() {
        return subtasks.size();
    }

    public SubTask get(String id) {
        Integer i = indexById.get(id);
        return i != null ? subtasks.get(i) : null;
    }

    /** Declaration position of the subtask, or -1 when the id is not part of the graph. */
    public int indexOf(String id) {
        Integer i = indexById.get(id);
        return i != null ? i : -1;
    }

    public boolean contains(String id) {
        return indexById.containsKey(id);
    }

    /** Ids of subtasks that declare a dependency on {@code id}, in declaration order. */
    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    /** Ids of subtasks with no dependencies. */
    public Set<String> roots() {
        Set<String> roots = new LinkedHashSet<>();
        for (SubTask t : subtasks) {
            if (t.getDependencies().isEmpty()) roots.add(t.getId());
        }
        return roots;
    }
}
