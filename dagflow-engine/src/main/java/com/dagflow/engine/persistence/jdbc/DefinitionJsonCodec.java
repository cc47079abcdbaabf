package com.dagflow.engine.persistence.jdbc;

import com.dagflow.core.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * JSON form of a workflow definition's graph and policies.
 * Identity, creation time and the deprecation flag live in their own columns.
 * Durations are stored as milliseconds.
 */
class DefinitionJsonCodec {

    private final ObjectMapper objectMapper;

    DefinitionJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(WorkflowDefinition definition) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("description", definition.description());
        root.put("failurePolicy", definition.failurePolicy().name());
        root.set("defaultRetryPolicy", writePolicy(definition.defaultRetryPolicy()));
        root.set("labels", objectMapper.valueToTree(definition.labels()));

        ArrayNode tasks = root.putArray("tasks");
        for (TaskSpec spec : definition.tasks()) {
            ObjectNode task = tasks.addObject();
            task.put("name", spec.name());
            task.put("executableRef", spec.executableRef());
            task.put("description", spec.description());
            if (spec.timeout() != null) {
                task.put("timeoutMs", spec.timeout().toMillis());
            }
            if (spec.retryPolicy() != null) {
                task.set("retryPolicy", writePolicy(spec.retryPolicy()));
            }
        }

        ArrayNode edges = root.putArray("edges");
        for (Edge edge : definition.edges()) {
            edges.addObject().put("from", edge.from()).put("to", edge.to());
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize definition " + definition.id(), e);
        }
    }

    WorkflowDefinition read(String name, int version, String json, Instant createdAt, boolean deprecated) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt definition JSON for " + name + ":" + version, e);
        }

        List<TaskSpec> tasks = new ArrayList<>();
        for (JsonNode task : root.path("tasks")) {
            tasks.add(new TaskSpec(
                task.path("name").asText(),
                task.path("executableRef").asText(),
                task.hasNonNull("retryPolicy") ? readPolicy(task.get("retryPolicy")) : null,
                task.hasNonNull("timeoutMs") ? Duration.ofMillis(task.get("timeoutMs").asLong()) : null,
                textOrNull(task, "description")
            ));
        }

        List<Edge> edges = new ArrayList<>();
        for (JsonNode edge : root.path("edges")) {
            edges.add(new Edge(edge.path("from").asText(), edge.path("to").asText()));
        }

        Map<String, String> labels = new LinkedHashMap<>();
        root.path("labels").fields().forEachRemaining(e -> labels.put(e.getKey(), e.getValue().asText()));

        return new WorkflowDefinition(
            name,
            version,
            tasks,
            edges,
            FailurePolicy.valueOf(root.path("failurePolicy").asText(FailurePolicy.FAIL_SLOW.name())),
            root.hasNonNull("defaultRetryPolicy") ? readPolicy(root.get("defaultRetryPolicy")) : null,
            textOrNull(root, "description"),
            labels,
            createdAt,
            deprecated
        );
    }

    private ObjectNode writePolicy(RetryPolicy policy) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("maxAttempts", policy.maxAttempts());
        node.put("initialBackoffMs", policy.initialBackoff().toMillis());
        node.put("maxBackoffMs", policy.maxBackoff().toMillis());
        node.put("backoffMultiplier", policy.backoffMultiplier());
        node.put("jitterFactor", policy.jitterFactor());
        node.set("retryableErrors", objectMapper.valueToTree(new TreeSet<>(policy.retryableErrors())));
        node.set("nonRetryableErrors", objectMapper.valueToTree(new TreeSet<>(policy.nonRetryableErrors())));
        return node;
    }

    private RetryPolicy readPolicy(JsonNode node) {
        return new RetryPolicy(
            node.path("maxAttempts").asInt(),
            Duration.ofMillis(node.path("initialBackoffMs").asLong()),
            Duration.ofMillis(node.path("maxBackoffMs").asLong()),
            node.path("backoffMultiplier").asDouble(),
            node.path("jitterFactor").asDouble(),
            readStrings(node.path("retryableErrors")),
            readStrings(node.path("nonRetryableErrors"))
        );
    }

    private static Set<String> readStrings(JsonNode array) {
        Set<String> values = new HashSet<>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
