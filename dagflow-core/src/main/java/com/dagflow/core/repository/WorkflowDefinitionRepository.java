package com.dagflow.core.repository;

import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Definitions are immutable once stored, except for the deprecation flag.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a new workflow definition.
     *
     * @param definition The workflow definition to store
     * @throws com.dagflow.core.exception.ConflictException if the same name and version already exist
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by identity.
     *
     * @param id Name and version
     * @return The workflow definition if found
     */
    Optional<WorkflowDefinition> find(DefinitionId id);

    /**
     * Find the highest version registered under a name.
     *
     * @param name The workflow name
     * @return The latest workflow definition if found
     */
    Optional<WorkflowDefinition> findLatest(String name);

    /**
     * List all versions of a workflow definition.
     *
     * @param name The workflow name
     * @return All versions ordered by version number descending
     */
    List<WorkflowDefinition> listVersions(String name);

    /**
     * List the latest version of every registered workflow, ordered by name.
     */
    List<WorkflowDefinition> listLatest();

    /**
     * Replace the stored definition with its deprecated copy.
     *
     * @param id Name and version
     * @return true if the definition exists
     */
    boolean markDeprecated(DefinitionId id);

    /**
     * Get the next available version number for a workflow.
     *
     * @param name The workflow name
     * @return The next version number (1 if no versions exist)
     */
    int getNextVersion(String name);
}
