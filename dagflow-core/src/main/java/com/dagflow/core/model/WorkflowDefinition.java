package com.dagflow.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a workflow: a DAG of named tasks.
 * Versioned so that new versions never affect runs of older ones.
 *
 * Primary Key: {name}:{version}
 *
 * Invariants (checked by {@link com.dagflow.core.graph.WorkflowGraph}):
 * - task names are unique
 * - every edge references existing tasks
 * - graph is acyclic
 */
public record WorkflowDefinition(
    // Identity
    String name,
    int version,

    // Graph structure
    List<TaskSpec> tasks,
    List<Edge> edges,

    // Policies
    FailurePolicy failurePolicy,
    RetryPolicy defaultRetryPolicy,

    // Metadata
    String description,
    Map<String, String> labels,
    Instant createdAt,
    boolean deprecated
) {
    public WorkflowDefinition {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        // Duplicate edges collapse, declaration order is kept
        edges = edges == null ? List.of() : List.copyOf(new LinkedHashSet<>(edges));
        failurePolicy = failurePolicy == null ? FailurePolicy.FAIL_SLOW : failurePolicy;
        defaultRetryPolicy = defaultRetryPolicy == null ? RetryPolicy.defaultPolicy() : defaultRetryPolicy;
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public DefinitionId id() {
        return new DefinitionId(name, version);
    }

    /**
     * Copy stamped with the identity and registration time assigned by the graph store.
     */
    public WorkflowDefinition asRegistered(int assignedVersion, Instant registeredAt) {
        return new WorkflowDefinition(
            name, assignedVersion, tasks, edges, failurePolicy, defaultRetryPolicy,
            description, labels, registeredAt.truncatedTo(ChronoUnit.MILLIS), false
        );
    }

    public WorkflowDefinition asDeprecated() {
        return new WorkflowDefinition(
            name, version, tasks, edges, failurePolicy, defaultRetryPolicy,
            description, labels, createdAt, true
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int version;
        private final List<TaskSpec> tasks = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_SLOW;
        private RetryPolicy defaultRetryPolicy = RetryPolicy.defaultPolicy();
        private String description;
        private Map<String, String> labels = Map.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder task(TaskSpec task) {
            this.tasks.add(task);
            return this;
        }

        public Builder tasks(List<TaskSpec> tasks) {
            this.tasks.addAll(tasks);
            return this;
        }

        /**
         * Declare that {@code to} depends on {@code from}.
         */
        public Builder edge(String from, String to) {
            this.edges.add(new Edge(from, to));
            return this;
        }

        public Builder edges(List<Edge> edges) {
            this.edges.addAll(edges);
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                name, version, tasks, edges, failurePolicy, defaultRetryPolicy,
                description, labels, null, false
            );
        }
    }
}
