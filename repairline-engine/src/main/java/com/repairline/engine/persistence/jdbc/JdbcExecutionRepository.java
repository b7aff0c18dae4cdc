package com.repairline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.exception.OptimisticLockException;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.model.TaskResult;
import com.repairline.core.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.repairline.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.repairline.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of ExecutionRepository.
 * Updates are conditional on the stored version.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final JavaType taskResultList;
    private final JavaType stringList;
    private final RowMapper<Execution> rowMapper = new ExecutionRowMapper();

    public JdbcExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.taskResultList = json.listOf(TaskResult.class);
        this.stringList = json.listOf(String.class);
    }

    @Override
    @Transactional
    public boolean insert(Execution execution) {
        String sql = """
            INSERT INTO workflow_executions (
                id, workflow_id, workflow_name, tenant_id, status,
                input_json, output_json, task_results_json,
                current_tasks, completed_tasks, failed_tasks,
                error, start_time, end_time, cancelled_at, version
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            execution.id(),
            execution.workflowId(),
            execution.workflowName(),
            execution.tenantId(),
            execution.status().name(),
            json.toJson(execution.input()),
            json.toJson(execution.output()),
            json.toJson(execution.taskResults()),
            json.toJson(execution.currentTasks()),
            json.toJson(execution.completedTasks()),
            json.toJson(execution.failedTasks()),
            execution.error(),
            toTimestamp(execution.startTime()),
            toTimestamp(execution.endTime()),
            toTimestamp(execution.cancelledAt()),
            execution.version()
        );

        if (rows == 0) {
            log.debug("Execution already exists: {}", execution.id());
        }
        return rows == 1;
    }

    @Override
    @Transactional
    public Execution update(Execution execution, long expectedVersion) {
        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                output_json = ?::jsonb,
                task_results_json = ?::jsonb,
                current_tasks = ?::jsonb,
                completed_tasks = ?::jsonb,
                failed_tasks = ?::jsonb,
                error = ?,
                end_time = ?,
                cancelled_at = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            execution.status().name(),
            json.toJson(execution.output()),
            json.toJson(execution.taskResults()),
            json.toJson(execution.currentTasks()),
            json.toJson(execution.completedTasks()),
            json.toJson(execution.failedTasks()),
            execution.error(),
            toTimestamp(execution.endTime()),
            toTimestamp(execution.cancelledAt()),
            execution.version(),
            execution.id(),
            expectedVersion
        );

        if (rows == 0) {
            throw new OptimisticLockException("Execution", execution.id(), expectedVersion);
        }
        return execution;
    }

    @Override
    public Optional<Execution> findById(String id) {
        List<Execution> results = jdbcTemplate.query(
            "SELECT * FROM workflow_executions WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Execution> findByWorkflowId(String workflowId) {
        String sql = "SELECT * FROM workflow_executions WHERE workflow_id = ? ORDER BY start_time DESC";
        return jdbcTemplate.query(sql, rowMapper, workflowId);
    }

    @Override
    public List<Execution> findByStatus(ExecutionStatus status, int limit) {
        String sql = "SELECT * FROM workflow_executions WHERE status = ? ORDER BY start_time LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    private class ExecutionRowMapper implements RowMapper<Execution> {
        @Override
        public Execution mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Execution(
                rs.getString("id"),
                rs.getString("workflow_id"),
                rs.getString("workflow_name"),
                rs.getString("tenant_id"),
                ExecutionStatus.valueOf(rs.getString("status")),
                json.readTree(rs.getString("input_json")),
                json.readTree(rs.getString("output_json")),
                json.read(rs.getString("task_results_json"), taskResultList),
                json.read(rs.getString("current_tasks"), stringList),
                json.read(rs.getString("completed_tasks"), stringList),
                json.read(rs.getString("failed_tasks"), stringList),
                rs.getString("error"),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("end_time")),
                toInstant(rs.getTimestamp("cancelled_at")),
                rs.getLong("version")
            );
        }
    }
}
