package com.dagflow.engine.persistence.jdbc;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.WorkflowDefinition;
import com.dagflow.core.repository.WorkflowDefinitionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of WorkflowDefinitionRepository.
 * The task list, edges and policies are stored as one JSON document per version.
 */
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final DefinitionJsonCodec codec;
    private final RowMapper<WorkflowDefinition> rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = new DefinitionJsonCodec(objectMapper);
        this.rowMapper = (rs, rowNum) -> codec.read(
            rs.getString("name"),
            rs.getInt("version"),
            rs.getString("definition_json"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getBoolean("deprecated")
        );
    }

    @Override
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (name, version, definition_json, deprecated, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                definition.name(),
                definition.version(),
                codec.write(definition),
                definition.deprecated(),
                Timestamp.from(definition.createdAt())
            );
        } catch (DuplicateKeyException e) {
            throw new ConflictException("WorkflowDefinition", definition.id().toString(), "already exists");
        }
        log.debug("Stored workflow definition {}", definition.id());
    }

    @Override
    public Optional<WorkflowDefinition> find(DefinitionId id) {
        String sql = "SELECT * FROM workflow_definitions WHERE name = ? AND version = ?";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, id.name(), id.version());
        return results.stream().findFirst();
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        String sql = "SELECT * FROM workflow_definitions WHERE name = ? ORDER BY version DESC LIMIT 1";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, name);
        return results.stream().findFirst();
    }

    @Override
    public List<WorkflowDefinition> listVersions(String name) {
        String sql = "SELECT * FROM workflow_definitions WHERE name = ? ORDER BY version DESC";
        return jdbcTemplate.query(sql, rowMapper, name);
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        String sql = """
            SELECT d.* FROM workflow_definitions d
            WHERE d.version = (SELECT MAX(x.version) FROM workflow_definitions x WHERE x.name = d.name)
            ORDER BY d.name
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    @Override
    public boolean markDeprecated(DefinitionId id) {
        String sql = "UPDATE workflow_definitions SET deprecated = TRUE WHERE name = ? AND version = ?";
        return jdbcTemplate.update(sql, id.name(), id.version()) > 0;
    }

    @Override
    public int getNextVersion(String name) {
        String sql = "SELECT COALESCE(MAX(version), 0) + 1 FROM workflow_definitions WHERE name = ?";
        Integer next = jdbcTemplate.queryForObject(sql, Integer.class, name);
        return next != null ? next : 1;
    }
}
