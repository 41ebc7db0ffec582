package com.taskgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.repository.DefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of DefinitionRepository.
 * Workflow definitions are immutable once stored.
 *
 * The whole definition (tasks, transitions, retry policies) is kept as one JSONB
 * document next to its key columns.
 */
public class JdbcDefinitionRepository implements DefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowDefinitionRowMapper rowMapper;

    public JdbcDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new WorkflowDefinitionRowMapper();
    }

    @Override
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (name, version, definition_json, description, created_at)
            VALUES (?, ?, ?::jsonb, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                definition.name(),
                definition.version(),
                serializeJson(definition),
                definition.description(),
                Timestamp.from(definition.createdAt())
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Workflow definition already exists: " + definition.id(), e);
        }
        log.info("Saved workflow definition: {}", definition.id());
    }

    @Override
    public Optional<WorkflowDefinition> find(String name, int version) {
        String sql = "SELECT * FROM workflow_definitions WHERE name = ? AND version = ?";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, name, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE name = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String name) {
        String sql = "SELECT * FROM workflow_definitions WHERE name = ? ORDER BY version DESC";
        return jdbcTemplate.query(sql, rowMapper, name);
    }

    @Override
    public int getNextVersion(String name) {
        String sql = "SELECT COALESCE(MAX(version), 0) + 1 FROM workflow_definitions WHERE name = ?";
        Integer version = jdbcTemplate.queryForObject(sql, Integer.class, name);
        return version != null ? version : 1;
    }

    private String serializeJson(WorkflowDefinition definition) {
        try {
            return objectMapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow definition cannot be serialized: " + definition.id(), e);
        }
    }

    private class WorkflowDefinitionRowMapper implements RowMapper<WorkflowDefinition> {
        @Override
        public WorkflowDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                WorkflowDefinition stored = objectMapper.readValue(
                    rs.getString("definition_json"), WorkflowDefinition.class);
                // Key columns win over the document
                return stored.withVersion(rs.getInt("version"), rs.getTimestamp("created_at").toInstant());
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow definition row", e);
            }
        }
    }
}
