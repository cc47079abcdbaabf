package com.dagflow.examples.ingest;

import com.dagflow.engine.executor.TaskContext;
import com.dagflow.engine.executor.TaskException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated task handlers for the Document Ingestion workflow.
 *
 * These handlers demonstrate:
 * - Deterministic output for the same run parameters (safe to retry)
 * - A flaky external service with configurable transient failures
 * - A permanent failure that is never retried
 * - Cooperative cancellation for long-running work
 */
public final class DocumentIngestionHandlers {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionHandlers.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String INVALID_PARAMETER = "INVALID_PARAMETER";
    public static final String EMBEDDING_SERVICE_UNAVAILABLE = "EMBEDDING_SERVICE_UNAVAILABLE";
    public static final String INDEX_REJECTED = "INDEX_REJECTED";

    private static final int EMBEDDING_DIMENSIONS = 8;

    private static final String[] SUBJECTS = {
        "Quarterly revenue in Berlin grew after the Atlas launch",
        "Support tickets from Lisbon mention the Orion dashboard",
        "The Nimbus team in Toronto shipped a new search ranking",
        "Customers in Osaka asked for Atlas export to Parquet",
        "Security review of the Orion gateway found two issues",
        "Hiring plan for the Nimbus platform group in Dublin"
    };

    // Failure simulation, shared by all runs in this JVM
    private static final AtomicInteger embeddingCalls = new AtomicInteger(0);
    private static volatile int embeddingFailures = 0;
    private static volatile boolean rejectIndexWrites = false;
    private static volatile Duration embeddingLatency = Duration.ZERO;

    private DocumentIngestionHandlers() {
    }

    /**
     * Fetch Documents.
     * Produces {@code documentCount} documents from {@code source}, the same ones on every attempt.
     */
    public static JsonNode fetchDocuments(TaskContext context) throws TaskException {
        String source = context.getParameter("source", "inbox");
        int count = parseCount(context.getParameter("documentCount", "5"));

        log.info("Fetching {} documents from {}", count, source);

        ArrayNode documents = mapper.createArrayNode();
        for (int i = 0; i < count; i++) {
            ObjectNode document = documents.addObject();
            document.put("id", source + "/doc-" + (i + 1));
            document.put("text", SUBJECTS[i % SUBJECTS.length]);
        }

        ObjectNode result = mapper.createObjectNode();
        result.put("source", source);
        result.put("count", count);
        result.set("documents", documents);
        return result;
    }

    /**
     * Parse Documents.
     * Splits every fetched document into tokens.
     */
    public static JsonNode parseDocuments(TaskContext context) {
        JsonNode fetched = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_FETCH);

        ArrayNode parsed = mapper.createArrayNode();
        int totalTokens = 0;
        for (JsonNode document : fetched.get("documents")) {
            String[] tokens = document.get("text").asText().split("\\s+");
            ObjectNode entry = parsed.addObject();
            entry.put("id", document.get("id").asText());
            ArrayNode tokenArray = entry.putArray("tokens");
            Arrays.stream(tokens).forEach(tokenArray::add);
            totalTokens += tokens.length;
        }

        log.info("Parsed {} documents into {} tokens", parsed.size(), totalTokens);

        ObjectNode result = mapper.createObjectNode();
        result.put("tokenCount", totalTokens);
        result.set("documents", parsed);
        return result;
    }

    /**
     * Extract Entities.
     * Treats capitalized tokens after the first one as named entities.
     */
    public static JsonNode extractEntities(TaskContext context) {
        JsonNode parsed = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_PARSE);

        ObjectNode byDocument = mapper.createObjectNode();
        Set<String> distinct = new LinkedHashSet<>();
        for (JsonNode document : parsed.get("documents")) {
            ArrayNode entities = byDocument.putArray(document.get("id").asText());
            JsonNode tokens = document.get("tokens");
            for (int i = 1; i < tokens.size(); i++) {
                String token = tokens.get(i).asText();
                if (!token.isEmpty() && Character.isUpperCase(token.charAt(0))) {
                    entities.add(token);
                    distinct.add(token);
                }
            }
        }

        log.info("Extracted {} distinct entities", distinct.size());

        ObjectNode result = mapper.createObjectNode();
        result.put("distinctEntities", distinct.size());
        result.set("entities", byDocument);
        return result;
    }

    /**
     * Compute Embeddings (simulated external embedding service).
     *
     * DEMONSTRATES:
     * - Transient failures that succeed on retry
     * - Polling for cancellation while waiting on a slow service
     */
    public static JsonNode computeEmbeddings(TaskContext context) throws TaskException {
        int call = embeddingCalls.incrementAndGet();
        if (call <= embeddingFailures) {
            log.warn("SIMULATED FAILURE: embedding service unavailable (attempt {})",
                context.getAttemptNumber());
            throw TaskException.transientFailure(EMBEDDING_SERVICE_UNAVAILABLE,
                "Embedding service returned 503");
        }

        waitForService(context);
        if (context.isCancelled()) {
            throw TaskException.permanent("CANCELLED", "Stopped while waiting for the embedding service");
        }

        JsonNode parsed = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_PARSE);
        ObjectNode vectors = mapper.createObjectNode();
        for (JsonNode document : parsed.get("documents")) {
            ArrayNode vector = vectors.putArray(document.get("id").asText());
            int seed = document.get("tokens").toString().hashCode();
            for (int d = 0; d < EMBEDDING_DIMENSIONS; d++) {
                vector.add(((seed >>> d) & 0xFF) / 255.0);
            }
        }

        log.info("Computed {} embeddings of dimension {}", vectors.size(), EMBEDDING_DIMENSIONS);

        ObjectNode result = mapper.createObjectNode();
        result.put("dimensions", EMBEDDING_DIMENSIONS);
        result.set("vectors", vectors);
        return result;
    }

    /**
     * Index Documents.
     * Joins the entities and embeddings of every document into one index entry.
     */
    public static JsonNode indexDocuments(TaskContext context) throws TaskException {
        String index = context.getParameter("index", "documents");
        if (rejectIndexWrites) {
            log.warn("SIMULATED FAILURE: index {} rejected the batch", index);
            throw TaskException.permanent(INDEX_REJECTED, "Index " + index + " is read-only");
        }

        JsonNode entities = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_EXTRACT_ENTITIES).get("entities");
        JsonNode vectors = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_COMPUTE_EMBEDDINGS).get("vectors");

        ArrayNode indexed = mapper.createArrayNode();
        vectors.fieldNames().forEachRemaining(id -> {
            ObjectNode entry = indexed.addObject();
            entry.put("id", id);
            entry.put("entityCount", entities.path(id).size());
            entry.put("vectorSize", vectors.get(id).size());
        });

        log.info("Indexed {} documents into {}", indexed.size(), index);

        ObjectNode result = mapper.createObjectNode();
        result.put("index", index);
        result.put("indexedCount", indexed.size());
        result.set("entries", indexed);
        return result;
    }

    /**
     * Publish Report.
     */
    public static JsonNode publishReport(TaskContext context) {
        JsonNode indexed = context.getUpstreamResult(DocumentIngestionWorkflow.TASK_INDEX);

        ObjectNode result = mapper.createObjectNode();
        result.put("runId", context.getRunId().toString());
        result.put("index", indexed.get("index").asText());
        result.put("indexedCount", indexed.get("indexedCount").asInt());
        result.put("publishedAt", Instant.now().toString());

        log.info("Published ingestion report: {} documents in {}",
            result.get("indexedCount").asInt(), result.get("index").asText());
        return result;
    }

    // Configuration methods for failure simulation
    public static void failEmbeddings(int failCount) {
        embeddingFailures = failCount;
        embeddingCalls.set(0);
    }

    public static void rejectIndexWrites(boolean reject) {
        rejectIndexWrites = reject;
    }

    public static void slowEmbeddings(Duration latency) {
        embeddingLatency = latency;
    }

    public static int embeddingCalls() {
        return embeddingCalls.get();
    }

    public static void reset() {
        embeddingFailures = 0;
        embeddingCalls.set(0);
        rejectIndexWrites = false;
        embeddingLatency = Duration.ZERO;
    }

    private static int parseCount(String value) throws TaskException {
        try {
            int count = Integer.parseInt(value);
            if (count <= 0) {
                throw TaskException.permanent(INVALID_PARAMETER, "documentCount must be positive: " + value);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new TaskException(INVALID_PARAMETER, "documentCount is not a number: " + value, e, false);
        }
    }

    private static void waitForService(TaskContext context) {
        long deadline = System.nanoTime() + embeddingLatency.toNanos();
        while (System.nanoTime() < deadline && !context.isCancelled()) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
