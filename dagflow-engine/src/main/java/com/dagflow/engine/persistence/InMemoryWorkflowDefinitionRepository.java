package com.dagflow.engine.persistence;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.repository.WorkflowDefinitionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<DefinitionId, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowDefinition definition) {
        if (definitions.putIfAbsent(definition.id(), definition) != null) {
            throw new ConflictException("WorkflowDefinition", definition.id().toString(), "already exists");
        }
    }

    @Override
    public Optional<WorkflowDefinition> find(DefinitionId id) {
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .max(Comparator.comparing(WorkflowDefinition::version));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .sorted(Comparator.comparing(WorkflowDefinition::version).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        Map<String, WorkflowDefinition> latestByName = new TreeMap<>();
        definitions.values().forEach(d -> latestByName.merge(d.name(), d,
            (a, b) -> a.version() >= b.version() ? a : b));
        return new ArrayList<>(latestByName.values());
    }

    @Override
    public boolean markDeprecated(DefinitionId id) {
        return definitions.computeIfPresent(id, (k, d) -> d.asDeprecated()) != null;
    }

    @Override
    public int getNextVersion(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .mapToInt(WorkflowDefinition::version)
            .max()
            .orElse(0) + 1;
    }
}
