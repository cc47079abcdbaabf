package com.dagflow.core.graph;

import com.dagflow.core.exception.WorkflowValidationException;
import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.Edge;
import com.dagflow.core.model.TaskSpec;
import com.dagflow.core.model.WorkflowDefinition;

import java.util.*;

/**
 * Validated adjacency view of a workflow definition.
 *
 * The only way to obtain an instance is {@link #of(WorkflowDefinition)}, which rejects
 * malformed definitions. Holding a WorkflowGraph therefore means the task names are unique,
 * every edge points at a known task and the graph is acyclic, so scheduling never has to
 * re-check any of that.
 */
public final class WorkflowGraph {

    private final WorkflowDefinition definition;
    private final Map<String, TaskSpec> tasks;
    private final Map<String, List<String>> predecessors;
    private final Map<String, List<String>> successors;
    private final List<String> topologicalOrder;

    private WorkflowGraph(
            WorkflowDefinition definition,
            Map<String, TaskSpec> tasks,
            Map<String, List<String>> predecessors,
            Map<String, List<String>> successors,
            List<String> topologicalOrder) {
        this.definition = definition;
        this.tasks = tasks;
        this.predecessors = predecessors;
        this.successors = successors;
        this.topologicalOrder = topologicalOrder;
    }

    /**
     * Validate a definition and build its graph.
     *
     * @throws WorkflowValidationException on an empty definition, blank or duplicate task names,
     *         a missing executable reference, a non-positive timeout, a dangling edge or a cycle
     */
    public static WorkflowGraph of(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new WorkflowValidationException("name", "cannot be empty");
        }
        if (definition.tasks().isEmpty()) {
            throw new WorkflowValidationException("tasks", "cannot be empty");
        }

        Map<String, TaskSpec> tasks = indexTasks(definition.tasks());
        validateEdges(definition.edges(), tasks.keySet());

        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        Map<String, List<String>> successors = new LinkedHashMap<>();
        for (String name : tasks.keySet()) {
            predecessors.put(name, new ArrayList<>());
            successors.put(name, new ArrayList<>());
        }
        for (Edge edge : definition.edges()) {
            successors.get(edge.from()).add(edge.to());
            predecessors.get(edge.to()).add(edge.from());
        }

        List<String> order = topologicalSort(tasks.keySet(), predecessors, successors);

        Map<String, List<String>> frozenPredecessors = new LinkedHashMap<>();
        Map<String, List<String>> frozenSuccessors = new LinkedHashMap<>();
        predecessors.forEach((k, v) -> frozenPredecessors.put(k, List.copyOf(v)));
        successors.forEach((k, v) -> frozenSuccessors.put(k, List.copyOf(v)));

        return new WorkflowGraph(
            definition,
            Collections.unmodifiableMap(tasks),
            Collections.unmodifiableMap(frozenPredecessors),
            Collections.unmodifiableMap(frozenSuccessors),
            List.copyOf(order)
        );
    }

    private static Map<String, TaskSpec> indexTasks(List<TaskSpec> specs) {
        Map<String, TaskSpec> tasks = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<String> missingRef = new ArrayList<>();
        List<String> badTimeout = new ArrayList<>();

        for (TaskSpec spec : specs) {
            if (spec.name() == null || spec.name().isBlank()) {
                throw new WorkflowValidationException("tasks", "task name cannot be empty");
            }
            if (tasks.putIfAbsent(spec.name(), spec) != null) {
                duplicates.add(spec.name());
            }
            if (spec.executableRef() == null || spec.executableRef().isBlank()) {
                missingRef.add(spec.name());
            }
            if (spec.timeout() != null && (spec.timeout().isZero() || spec.timeout().isNegative())) {
                badTimeout.add(spec.name());
            }
        }

        if (!duplicates.isEmpty()) {
            throw new WorkflowValidationException("tasks", "duplicate task names", List.copyOf(duplicates));
        }
        if (!missingRef.isEmpty()) {
            throw new WorkflowValidationException("tasks", "missing executable reference", missingRef);
        }
        if (!badTimeout.isEmpty()) {
            throw new WorkflowValidationException("tasks", "timeout must be positive", badTimeout);
        }
        return tasks;
    }

    private static void validateEdges(List<Edge> edges, Set<String> taskNames) {
        List<String> dangling = new ArrayList<>();
        for (Edge edge : edges) {
            if (!taskNames.contains(edge.from()) || !taskNames.contains(edge.to())) {
                dangling.add(edge.toString());
            }
        }
        if (!dangling.isEmpty()) {
            throw new WorkflowValidationException("edges", "references unknown task", dangling);
        }
    }

    /**
     * Kahn's algorithm. Ties are broken by declaration order so the result is deterministic.
     */
    private static List<String> topologicalSort(
            Set<String> names,
            Map<String, List<String>> predecessors,
            Map<String, List<String>> successors) {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String name : names) {
            int degree = predecessors.get(name).size();
            inDegree.put(name, degree);
            if (degree == 0) {
                ready.add(name);
            }
        }

        List<String> order = new ArrayList<>(names.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String next : successors.get(current)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() < names.size()) {
            Set<String> unsorted = new LinkedHashSet<>(names);
            unsorted.removeAll(order);
            throw new WorkflowValidationException("edges", "graph contains a cycle",
                findCycle(unsorted, predecessors));
        }
        return order;
    }

    /**
     * Every task Kahn could not sort still has a predecessor among the unsorted ones,
     * so walking predecessors inside that set must revisit a task.
     */
    private static List<String> findCycle(Set<String> unsorted, Map<String, List<String>> predecessors) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> position = new HashMap<>();
        String current = unsorted.iterator().next();
        while (!position.containsKey(current)) {
            position.put(current, path.size());
            path.add(current);
            current = predecessors.get(current).stream()
                .filter(unsorted::contains)
                .findFirst()
                .orElseThrow();
        }
        List<String> cycle = new ArrayList<>(path.subList(position.get(current), path.size()));
        Collections.reverse(cycle);
        // Start the report at the earliest declared task on the cycle
        String first = unsorted.stream().filter(cycle::contains).findFirst().orElseThrow();
        Collections.rotate(cycle, -cycle.indexOf(first));
        cycle.add(cycle.get(0));
        return cycle;
    }

    public WorkflowDefinition definition() {
        return definition;
    }

    public DefinitionId id() {
        return definition.id();
    }

    public TaskSpec task(String name) {
        TaskSpec spec = tasks.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown task in " + definition.id() + ": " + name);
        }
        return spec;
    }

    public boolean contains(String name) {
        return tasks.containsKey(name);
    }

    public Set<String> taskNames() {
        return tasks.keySet();
    }

    public List<String> predecessors(String name) {
        return predecessors.getOrDefault(name, List.of());
    }

    public List<String> successors(String name) {
        return successors.getOrDefault(name, List.of());
    }

    /**
     * Tasks with no incoming edges, eligible as soon as a run starts.
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String name : topologicalOrder) {
            if (predecessors.get(name).isEmpty()) {
                roots.add(name);
            }
        }
        return roots;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public int size() {
        return tasks.size();
    }
}
