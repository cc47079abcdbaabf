package com.dagflow.examples.ingest;

import com.dagflow.core.model.RunView;
import com.dagflow.core.model.TaskAttemptRecord;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.model.WorkflowRun;
import com.dagflow.engine.config.EngineProperties;
import com.dagflow.engine.coordinator.RunCoordinator;
import com.dagflow.engine.executor.PooledTaskExecutor;
import com.dagflow.engine.executor.TaskHandlerRegistry;
import com.dagflow.engine.metrics.EngineMetrics;
import com.dagflow.engine.persistence.InMemoryRunStateStore;
import com.dagflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.dagflow.engine.registry.WorkflowRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Demonstration runner for the Document Ingestion workflow.
 *
 * Wires an in-memory engine without Spring and shows:
 * 1. Normal successful execution
 * 2. Retry on a transient failure
 * 3. Permanent failure skipping downstream tasks
 * 4. Cancellation of a running run
 */
public class DocumentIngestionDemo {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionDemo.class);
    private static final Duration RUN_TIMEOUT = Duration.ofSeconds(30);

    private final RunCoordinator engine;
    private final WorkflowDefinition definition;

    public DocumentIngestionDemo() {
        EngineProperties properties = EngineProperties.defaults();
        TaskHandlerRegistry handlers = DocumentIngestionWorkflow.registerHandlers(new TaskHandlerRegistry());
        WorkflowRegistry registry = new WorkflowRegistry(new InMemoryWorkflowDefinitionRepository(), Clock.systemUTC());

        this.engine = new RunCoordinator(
            registry,
            new InMemoryRunStateStore(),
            new PooledTaskExecutor(handlers, properties.getWorkerPoolSize(), properties.getDefaultTaskTimeout()),
            new EngineMetrics(),
            properties,
            Clock.systemUTC(),
            new ObjectMapper());
        this.definition = engine.register(DocumentIngestionWorkflow.createDefinition());
    }

    public static void main(String[] args) throws Exception {
        DocumentIngestionDemo demo = new DocumentIngestionDemo();

        log.info("======================================================================");
        log.info("  DAGFLOW - DOCUMENT INGESTION DEMONSTRATION");
        log.info("  Workflow {} with {} tasks", demo.definition.id(), demo.definition.tasks().size());
        log.info("======================================================================");

        try {
            demo.runScenario1_NormalExecution();
            demo.runScenario2_RetryOnTransientFailure();
            demo.runScenario3_PermanentFailure();
            demo.runScenario4_Cancellation();
        } finally {
            DocumentIngestionHandlers.reset();
            demo.shutdown();
        }

        log.info("======================================================================");
        log.info("  ALL DEMONSTRATIONS COMPLETE");
        log.info("======================================================================");
    }

    public WorkflowRun runScenario1_NormalExecution() throws InterruptedException {
        banner("SCENARIO 1: Normal Successful Execution");
        DocumentIngestionHandlers.reset();

        UUID runId = engine.start(definition.id(), DocumentIngestionWorkflow.sampleParameters("inbox", 4));
        return report(runId);
    }

    public WorkflowRun runScenario2_RetryOnTransientFailure() throws InterruptedException {
        banner("SCENARIO 2: Automatic Retry on Transient Failure");
        DocumentIngestionHandlers.reset();
        DocumentIngestionHandlers.failEmbeddings(2);

        UUID runId = engine.start(definition.id(), DocumentIngestionWorkflow.sampleParameters("archive", 3));
        return report(runId);
    }

    public WorkflowRun runScenario3_PermanentFailure() throws InterruptedException {
        banner("SCENARIO 3: Permanent Failure Skips Downstream Tasks");
        DocumentIngestionHandlers.reset();
        DocumentIngestionHandlers.rejectIndexWrites(true);

        UUID runId = engine.start(definition.id(), DocumentIngestionWorkflow.sampleParameters("inbox", 2));
        return report(runId);
    }

    public WorkflowRun runScenario4_Cancellation() throws InterruptedException {
        banner("SCENARIO 4: Cancelling a Running Workflow");
        DocumentIngestionHandlers.reset();
        DocumentIngestionHandlers.slowEmbeddings(Duration.ofSeconds(5));

        UUID runId = engine.start(definition.id(), DocumentIngestionWorkflow.sampleParameters("inbox", 2));
        Thread.sleep(500);
        log.info("Cancelling run {}", runId);
        engine.cancel(runId);
        return report(runId);
    }

    public RunCoordinator engine() {
        return engine;
    }

    public void shutdown() {
        engine.shutdown(Duration.ofSeconds(10));
    }

    private WorkflowRun report(UUID runId) throws InterruptedException {
        WorkflowRun run = engine.await(runId, RUN_TIMEOUT);
        RunView view = engine.describe(runId);

        log.info("Run {} finished as {}", runId, run.status());
        for (TaskAttemptRecord attempt : view.attempts()) {
            log.info("  {} #{} -> {}{}", attempt.taskName(), attempt.attemptNumber(), attempt.status(),
                attempt.errorCode() != null ? " (" + attempt.errorCode() + ")" : "");
        }
        if (run.failedTaskName() != null) {
            log.info("  failed task: {} ({})", run.failedTaskName(), run.lastError());
        }
        return run;
    }

    private static void banner(String title) {
        log.info("");
        log.info("----------------------------------------------------------------------");
        log.info(title);
        log.info("----------------------------------------------------------------------");
    }
}
