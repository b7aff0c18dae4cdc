package com.repairline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.model.WorkflowDefinition;
import com.repairline.core.repository.WorkflowDefinitionRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

import static com.repairline.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of WorkflowDefinitionRepository.
 * The task graph is stored as one JSONB document.
 */
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<WorkflowDefinition> rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = (rs, rowNum) -> json.read(rs.getString("definition_json"), WorkflowDefinition.class);
    }

    @Override
    @Transactional
    public WorkflowDefinition save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (id, name, version, definition_json, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                version = EXCLUDED.version,
                definition_json = EXCLUDED.definition_json
            """;
        jdbcTemplate.update(sql,
            definition.id(),
            definition.name(),
            definition.version(),
            json.toJson(definition),
            toTimestamp(definition.createdAt())
        );
        return definition;
    }

    @Override
    public Optional<WorkflowDefinition> findById(String id) {
        String sql = "SELECT definition_json FROM workflow_definitions WHERE id = ?";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> findAll() {
        return jdbcTemplate.query("SELECT definition_json FROM workflow_definitions ORDER BY created_at", rowMapper);
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        return jdbcTemplate.update("DELETE FROM workflow_definitions WHERE id = ?", id) > 0;
    }
}
