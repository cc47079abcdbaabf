package com.dagflow.engine.registry;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.exception.NotFoundException;
import com.dagflow.core.exception.WorkflowValidationException;
import com.dagflow.core.graph.WorkflowGraph;
import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Graph store: validates, versions and serves workflow definitions.
 *
 * Definitions are validated once, on registration. Validated graphs are cached by identity
 * and shared read-only by every run of that definition.
 */
public class WorkflowRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRegistry.class);

    private final WorkflowDefinitionRepository repository;
    private final Clock clock;
    private final Map<DefinitionId, WorkflowGraph> graphs = new ConcurrentHashMap<>();

    public WorkflowRegistry(WorkflowDefinitionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Validate and store a definition.
     * Version 0 means "next version"; an explicit version must not be registered yet.
     *
     * @return The stored definition with its assigned identity
     * @throws WorkflowValidationException if the graph is malformed or the version is taken
     */
    public synchronized WorkflowDefinition register(WorkflowDefinition definition) {
        log.info("Registering workflow: {}", definition.name());

        if (definition.version() < 0) {
            throw new WorkflowValidationException("version", "cannot be negative");
        }
        WorkflowGraph.of(definition);

        int version = definition.version() == 0
            ? repository.getNextVersion(definition.name())
            : definition.version();
        DefinitionId id = new DefinitionId(definition.name(), version);
        if (definition.version() != 0 && repository.find(id).isPresent()) {
            throw new WorkflowValidationException("version", "already registered", List.of(id.toString()));
        }

        WorkflowDefinition registered = definition.asRegistered(version, clock.instant());
        try {
            repository.save(registered);
        } catch (ConflictException e) {
            throw new WorkflowValidationException("version", "already registered", List.of(id.toString()));
        }
        graphs.put(id, WorkflowGraph.of(registered));

        log.info("Registered workflow: {} ({} tasks, {} edges)",
            id, registered.tasks().size(), registered.edges().size());
        return registered;
    }

    /**
     * @throws NotFoundException if no such definition is registered
     */
    public WorkflowDefinition get(DefinitionId id) {
        return repository.find(id)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", id.toString()));
    }

    /**
     * @throws NotFoundException if no version of the workflow is registered
     */
    public WorkflowDefinition getLatest(String name) {
        return repository.findLatest(name)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", name));
    }

    public List<WorkflowDefinition> listVersions(String name) {
        return repository.listVersions(name);
    }

    /**
     * Latest version of every registered workflow.
     */
    public List<WorkflowDefinition> list() {
        return repository.listLatest();
    }

    /**
     * Soft-deprecate a definition. New runs are refused; existing runs are unaffected.
     *
     * @throws NotFoundException if no such definition is registered
     */
    public WorkflowDefinition deprecate(DefinitionId id) {
        if (!repository.markDeprecated(id)) {
            throw new NotFoundException("WorkflowDefinition", id.toString());
        }
        log.info("Deprecated workflow: {}", id);
        return get(id);
    }

    /**
     * The validated graph of a registered definition.
     *
     * @throws NotFoundException if no such definition is registered
     */
    public WorkflowGraph graph(DefinitionId id) {
        WorkflowGraph cached = graphs.get(id);
        if (cached != null) {
            return cached;
        }
        // Stored by another process or before a restart
        WorkflowGraph graph = WorkflowGraph.of(get(id));
        graphs.putIfAbsent(id, graph);
        return graph;
    }
}
