package com.dagflow.examples.ingest;

import com.dagflow.core.model.FailurePolicy;
import com.dagflow.core.model.RetryPolicy;
import com.dagflow.core.model.TaskOutcome;
import com.dagflow.core.model.TaskSpec;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.engine.executor.TaskHandlerRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Document Ingestion Workflow Example.
 *
 * Demonstrates:
 * 1. Fan-out and fan-in over a diamond-shaped graph
 * 2. Results passed from upstream tasks to their dependents
 * 3. Automatic retries with backoff for a flaky external service
 * 4. Permanent failures that skip every downstream task
 *
 * Workflow Steps:
 * <pre>
 *   fetch_documents
 *         |
 *   parse_documents
 *      /        \
 * extract_     compute_
 * entities     embeddings
 *      \        /
 *   index_documents
 *         |
 *   publish_report
 * </pre>
 *
 * Run parameters:
 * - {@code source}: where documents are fetched from (default {@code inbox})
 * - {@code documentCount}: how many documents to fetch (default 5)
 * - {@code index}: the search index to write to (default {@code documents})
 */
public final class DocumentIngestionWorkflow {

    public static final String WORKFLOW_NAME = "document-ingestion";

    // Task names
    public static final String TASK_FETCH = "fetch_documents";
    public static final String TASK_PARSE = "parse_documents";
    public static final String TASK_EXTRACT_ENTITIES = "extract_entities";
    public static final String TASK_COMPUTE_EMBEDDINGS = "compute_embeddings";
    public static final String TASK_INDEX = "index_documents";
    public static final String TASK_PUBLISH = "publish_report";

    // Executable references
    public static final String REF_FETCH = "ingest.fetch";
    public static final String REF_PARSE = "ingest.parse";
    public static final String REF_EXTRACT_ENTITIES = "ingest.entities";
    public static final String REF_COMPUTE_EMBEDDINGS = "ingest.embeddings";
    public static final String REF_INDEX = "ingest.index";
    public static final String REF_PUBLISH = "ingest.publish";

    private DocumentIngestionWorkflow() {
    }

    /**
     * Creates the workflow definition with the default failure policy (FAIL_SLOW).
     */
    public static WorkflowDefinition createDefinition() {
        return createDefinition(FailurePolicy.FAIL_SLOW);
    }

    public static WorkflowDefinition createDefinition(FailurePolicy failurePolicy) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("team", "search");
        labels.put("tier", "batch");

        return WorkflowDefinition.builder()
            .name(WORKFLOW_NAME)
            .description("Fetches, parses, enriches and indexes a batch of documents")
            .labels(labels)
            .failurePolicy(failurePolicy)
            .defaultRetryPolicy(RetryPolicy.builder()
                .maxAttempts(2)
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(1))
                .backoffMultiplier(2.0)
                .jitterFactor(0.0)
                .build())
            .task(TaskSpec.builder()
                .name(TASK_FETCH)
                .executableRef(REF_FETCH)
                .description("Lists and downloads the documents of the batch")
                .timeout(Duration.ofSeconds(30))
                .retryPolicy(RetryPolicy.builder()
                    .maxAttempts(3)
                    .initialBackoff(Duration.ofMillis(200))
                    .maxBackoff(Duration.ofSeconds(2))
                    .backoffMultiplier(2.0)
                    .jitterFactor(0.1)
                    .nonRetryableErrors(Set.of(DocumentIngestionHandlers.INVALID_PARAMETER))
                    .build())
                .build())
            .task(TaskSpec.builder()
                .name(TASK_PARSE)
                .executableRef(REF_PARSE)
                .description("Tokenizes each document")
                .timeout(Duration.ofSeconds(30))
                .build())
            .task(TaskSpec.builder()
                .name(TASK_EXTRACT_ENTITIES)
                .executableRef(REF_EXTRACT_ENTITIES)
                .description("Finds named entities in each document")
                .timeout(Duration.ofSeconds(30))
                .build())
            .task(TaskSpec.builder()
                .name(TASK_COMPUTE_EMBEDDINGS)
                .executableRef(REF_COMPUTE_EMBEDDINGS)
                .description("Calls the embedding service for each document")
                .timeout(Duration.ofSeconds(10))
                .retryPolicy(RetryPolicy.builder()
                    .maxAttempts(4)
                    .initialBackoff(Duration.ofMillis(200))
                    .maxBackoff(Duration.ofSeconds(2))
                    .backoffMultiplier(2.0)
                    .jitterFactor(0.1)
                    .retryableErrors(Set.of(
                        DocumentIngestionHandlers.EMBEDDING_SERVICE_UNAVAILABLE,
                        TaskOutcome.TASK_TIMEOUT))
                    .build())
                .build())
            .task(TaskSpec.builder()
                .name(TASK_INDEX)
                .executableRef(REF_INDEX)
                .description("Writes documents, entities and vectors to the search index")
                .timeout(Duration.ofSeconds(30))
                .build())
            .task(TaskSpec.builder()
                .name(TASK_PUBLISH)
                .executableRef(REF_PUBLISH)
                .description("Publishes a summary of the batch")
                .timeout(Duration.ofSeconds(10))
                .retryPolicy(RetryPolicy.noRetry())
                .build())
            .edge(TASK_FETCH, TASK_PARSE)
            .edge(TASK_PARSE, TASK_EXTRACT_ENTITIES)
            .edge(TASK_PARSE, TASK_COMPUTE_EMBEDDINGS)
            .edge(TASK_EXTRACT_ENTITIES, TASK_INDEX)
            .edge(TASK_COMPUTE_EMBEDDINGS, TASK_INDEX)
            .edge(TASK_INDEX, TASK_PUBLISH)
            .build();
    }

    /**
     * Registers the handlers of every task in this workflow.
     */
    public static TaskHandlerRegistry registerHandlers(TaskHandlerRegistry registry) {
        return registry
            .register(REF_FETCH, DocumentIngestionHandlers::fetchDocuments)
            .register(REF_PARSE, DocumentIngestionHandlers::parseDocuments)
            .register(REF_EXTRACT_ENTITIES, DocumentIngestionHandlers::extractEntities)
            .register(REF_COMPUTE_EMBEDDINGS, DocumentIngestionHandlers::computeEmbeddings)
            .register(REF_INDEX, DocumentIngestionHandlers::indexDocuments)
            .register(REF_PUBLISH, DocumentIngestionHandlers::publishReport);
    }

    /**
     * Creates sample run parameters.
     */
    public static Map<String, String> sampleParameters(String source, int documentCount) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("source", source);
        parameters.put("documentCount", String.valueOf(documentCount));
        parameters.put("index", "documents");
        return parameters;
    }
}
