package com.dagflow.engine.persistence.jdbc;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.exception.NotFoundException;
import com.dagflow.core.model.*;
import com.dagflow.core.repository.AttemptGuard;
import com.dagflow.core.repository.RunQuery;
import com.dagflow.core.repository.RunStateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.function.UnaryOperator;

/**
 * JDBC-backed implementation of RunStateStore.
 *
 * Every run mutation and every dispatch runs in its own transaction holding a
 * {@code SELECT ... FOR UPDATE} lock on the run row, so writes to one run are serialized
 * while different runs lock different rows. Run updates also bump {@code sequence_number}
 * and check the previous value.
 */
public class JdbcRunStateStore implements RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStateStore.class);

    private static final TypeReference<Map<String, String>> PARAMETERS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkflowRun> runMapper = this::mapRun;
    private final RowMapper<TaskAttemptRecord> attemptMapper = this::mapAttempt;

    public JdbcRunStateStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                             ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createRun(WorkflowRun run) {
        String sql = """
            INSERT INTO workflow_runs (
                run_id, definition_name, definition_version, status, parameters_json,
                created_at, started_at, completed_at, failed_task_name, last_error, sequence_number
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                run.runId(),
                run.definitionId().name(),
                run.definitionId().version(),
                run.status().name(),
                toJson(run.parameters()),
                toTimestamp(run.createdAt()),
                toTimestamp(run.startedAt()),
                toTimestamp(run.completedAt()),
                run.failedTaskName(),
                run.lastError(),
                run.sequenceNumber()
            );
        } catch (DuplicateKeyException e) {
            throw new ConflictException("WorkflowRun", run.runId().toString(), "already exists");
        }
    }

    @Override
    public Optional<WorkflowRun> findRun(UUID runId) {
        String sql = "SELECT * FROM workflow_runs WHERE run_id = ?";
        return jdbcTemplate.query(sql, runMapper, runId).stream().findFirst();
    }

    private WorkflowRun lockRun(UUID runId) {
        String sql = "SELECT * FROM workflow_runs WHERE run_id = ? FOR UPDATE";
        return jdbcTemplate.query(sql, runMapper, runId).stream()
            .findFirst()
            .orElseThrow(() -> new NotFoundException("WorkflowRun", String.valueOf(runId)));
    }

    @Override
    public WorkflowRun updateRun(UUID runId, UnaryOperator<WorkflowRun> mutation) {
        return transactionTemplate.execute(status -> {
            WorkflowRun current = lockRun(runId);
            WorkflowRun updated = Objects.requireNonNull(mutation.apply(current), "mutation result");
            if (updated.equals(current)) {
                return current;
            }
            if (!updated.runId().equals(runId)) {
                throw new IllegalArgumentException("Mutation changed the run id of " + runId);
            }

            String sql = """
                UPDATE workflow_runs SET
                    status = ?,
                    started_at = ?,
                    completed_at = ?,
                    failed_task_name = ?,
                    last_error = ?,
                    sequence_number = ?
                WHERE run_id = ? AND sequence_number = ?
                """;
            int rows = jdbcTemplate.update(sql,
                updated.status().name(),
                toTimestamp(updated.startedAt()),
                toTimestamp(updated.completedAt()),
                updated.failedTaskName(),
                updated.lastError(),
                updated.sequenceNumber(),
                runId,
                current.sequenceNumber()
            );
            if (rows == 0) {
                throw new ConflictException("WorkflowRun", runId.toString(),
                    "sequence number " + current.sequenceNumber() + " is stale");
            }
            return updated;
        });
    }

    @Override
    public TaskAttemptRecord beginAttempt(UUID runId, String taskName, int attemptNumber, Instant now) {
        return transactionTemplate.execute(status -> {
            WorkflowRun run = lockRun(runId);
            AttemptGuard.checkCanBegin(run, taskName, attemptNumber, findAttempts(runId, taskName));

            TaskAttemptRecord record = TaskAttemptRecord.start(runId, taskName, attemptNumber, now);
            String sql = """
                INSERT INTO task_attempts (run_id, task_name, attempt_number, status, started_at)
                VALUES (?, ?, ?, ?, ?)
                """;
            try {
                jdbcTemplate.update(sql, runId, taskName, attemptNumber,
                    record.status().name(), toTimestamp(record.startedAt()));
            } catch (DuplicateKeyException e) {
                throw new ConflictException("TaskAttempt", record.key(), "already recorded");
            }
            return record;
        });
    }

    @Override
    public TaskAttemptRecord updateAttempt(UUID runId, String taskName, int attemptNumber,
                                           UnaryOperator<TaskAttemptRecord> mutation) {
        return transactionTemplate.execute(status -> {
            String select = """
                SELECT * FROM task_attempts
                WHERE run_id = ? AND task_name = ? AND attempt_number = ?
                FOR UPDATE
                """;
            TaskAttemptRecord current = jdbcTemplate.query(select, attemptMapper, runId, taskName, attemptNumber)
                .stream()
                .findFirst()
                .orElseThrow(() -> new NotFoundException("TaskAttempt", runId + ":" + taskName + ":" + attemptNumber));
            TaskAttemptRecord updated = Objects.requireNonNull(mutation.apply(current), "mutation result");

            String sql = """
                UPDATE task_attempts SET
                    status = ?,
                    ended_at = ?,
                    error_code = ?,
                    error_detail = ?,
                    result_json = ?,
                    retry_not_before = ?
                WHERE run_id = ? AND task_name = ? AND attempt_number = ?
                """;
            jdbcTemplate.update(sql,
                updated.status().name(),
                toTimestamp(updated.endedAt()),
                updated.errorCode(),
                updated.errorDetail(),
                toJson(updated.result()),
                toTimestamp(updated.retryNotBefore()),
                runId,
                taskName,
                attemptNumber
            );
            return updated;
        });
    }

    @Override
    public List<TaskAttemptRecord> findAttempts(UUID runId) {
        String sql = """
            SELECT * FROM task_attempts WHERE run_id = ?
            ORDER BY started_at, attempt_number, task_name
            """;
        return jdbcTemplate.query(sql, attemptMapper, runId);
    }

    @Override
    public List<TaskAttemptRecord> findAttempts(UUID runId, String taskName) {
        String sql = "SELECT * FROM task_attempts WHERE run_id = ? AND task_name = ? ORDER BY attempt_number";
        return jdbcTemplate.query(sql, attemptMapper, runId, taskName);
    }

    @Override
    public List<WorkflowRun> findRuns(RunQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM workflow_runs WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.definitionName() != null) {
            sql.append(" AND definition_name = ?");
            args.add(query.definitionName());
        }
        if (query.definitionVersion() != null) {
            sql.append(" AND definition_version = ?");
            args.add(query.definitionVersion());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            args.add(query.status().name());
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(query.effectiveLimit());
        return jdbcTemplate.query(sql.toString(), runMapper, args.toArray());
    }

    @Override
    public int purgeTerminatedBefore(Instant cutoff) {
        Integer purged = transactionTemplate.execute(status -> {
            String terminal = "status IN ('SUCCEEDED', 'FAILED', 'CANCELLED') AND completed_at < ?";
            jdbcTemplate.update(
                "DELETE FROM task_attempts WHERE run_id IN (SELECT run_id FROM workflow_runs WHERE " + terminal + ")",
                Timestamp.from(cutoff));
            return jdbcTemplate.update("DELETE FROM workflow_runs WHERE " + terminal, Timestamp.from(cutoff));
        });
        int count = purged != null ? purged : 0;
        if (count > 0) {
            log.debug("Purged {} runs completed before {}", count, cutoff);
        }
        return count;
    }

    // ========== Helper Methods ==========

    private WorkflowRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        return new WorkflowRun(
            rs.getObject("run_id", UUID.class),
            new DefinitionId(rs.getString("definition_name"), rs.getInt("definition_version")),
            RunStatus.valueOf(rs.getString("status")),
            parseParameters(rs.getString("parameters_json")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("failed_task_name"),
            rs.getString("last_error"),
            rs.getLong("sequence_number")
        );
    }

    private TaskAttemptRecord mapAttempt(ResultSet rs, int rowNum) throws SQLException {
        return new TaskAttemptRecord(
            rs.getObject("run_id", UUID.class),
            rs.getString("task_name"),
            rs.getInt("attempt_number"),
            AttemptStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("ended_at")),
            rs.getString("error_code"),
            rs.getString("error_detail"),
            parseJsonNode(rs.getString("result_json")),
            toInstant(rs.getTimestamp("retry_not_before"))
        );
    }

    private Map<String, String> parseParameters(String json) throws SQLException {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PARAMETERS_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to parse run parameters", e);
        }
    }

    private JsonNode parseJsonNode(String json) throws SQLException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to parse attempt result", e);
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
