package com.dagflow.core.repository;

import com.dagflow.core.model.RunStatus;

/**
 * Filter for listing runs. Null fields match everything.
 */
public record RunQuery(
    String definitionName,
    Integer definitionVersion,
    RunStatus status,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public static RunQuery all() {
        return new RunQuery(null, null, null, DEFAULT_LIMIT);
    }

    public static RunQuery byStatus(RunStatus status) {
        return new RunQuery(null, null, status, DEFAULT_LIMIT);
    }

    public static RunQuery byDefinition(String definitionName) {
        return new RunQuery(definitionName, null, null, DEFAULT_LIMIT);
    }

    public int effectiveLimit() {
        return limit > 0 ? limit : DEFAULT_LIMIT;
    }
}
