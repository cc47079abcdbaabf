package com.dagflow.engine.service;

import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.RunView;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.model.WorkflowRun;
import com.dagflow.core.repository.RunQuery;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Boundary of the engine: what an API layer sitting on top of it calls.
 */
public interface WorkflowEngine {

    /**
     * Register a workflow definition.
     *
     * @param definition The workflow definition, version 0 to assign the next one
     * @return The registered definition with its identity
     * @throws com.dagflow.core.exception.WorkflowValidationException with the offending cycle, edge or task
     */
    WorkflowDefinition register(WorkflowDefinition definition);

    /**
     * Start a run of a registered definition.
     *
     * @param definitionId Name and version of the definition
     * @param parameters Opaque key/value bag passed through to every task
     * @return The id of the new run
     * @throws com.dagflow.core.exception.NotFoundException if the definition is unknown
     * @throws com.dagflow.core.exception.WorkflowValidationException if the definition is deprecated
     */
    UUID start(DefinitionId definitionId, Map<String, String> parameters);

    /**
     * Start a run of the latest version of a workflow.
     */
    UUID startLatest(String workflowName, Map<String, String> parameters);

    /**
     * Request cancellation. Always returns normally, whether or not the run was still
     * active or even exists.
     */
    void cancel(UUID runId);

    /**
     * @throws com.dagflow.core.exception.NotFoundException if the run is unknown
     */
    WorkflowRun status(UUID runId);

    /**
     * The run together with every attempt recorded for it.
     *
     * @throws com.dagflow.core.exception.NotFoundException if the run is unknown
     */
    RunView describe(UUID runId);

    /**
     * Wait until the run's loop has finished, meaning the run is terminal and no attempt is
     * still in flight, or until the timeout elapses.
     *
     * @return The run as stored when the wait ended
     * @throws com.dagflow.core.exception.NotFoundException if the run is unknown
     */
    WorkflowRun await(UUID runId, Duration timeout) throws InterruptedException;

    List<WorkflowRun> listRuns(RunQuery query);
}
