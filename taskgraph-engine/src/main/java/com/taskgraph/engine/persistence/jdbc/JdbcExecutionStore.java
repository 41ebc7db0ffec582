package com.taskgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.ExecutionQuery;
import com.taskgraph.core.repository.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ExecutionStore.
 *
 * The {@code version} column of the executions table is the optimistic lock:
 * a commit only succeeds when it moves the row from version n-1 to n, and the
 * task execution rows are written in the same transaction.
 *
 * Dispatch confirmations are single-row updates outside the version protocol;
 * an upsert with an unchanged nonce keeps a confirmation recorded in between.
 */
public class JdbcExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private static final String UPSERT_TASK_SQL = """
        INSERT INTO task_executions (
            id, execution_id, task_name, iteration, item_index, group_id,
            status, attempt, input_json, result_json, error_code, error_message,
            retry_at, dispatch_nonce, dispatched_at, dispatch_confirmed_at, dispatch_count, timeout_at,
            satisfied_inbound, ready, transitions_fired, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE SET
            status = EXCLUDED.status,
            attempt = EXCLUDED.attempt,
            item_index = EXCLUDED.item_index,
            input_json = EXCLUDED.input_json,
            result_json = EXCLUDED.result_json,
            error_code = EXCLUDED.error_code,
            error_message = EXCLUDED.error_message,
            retry_at = EXCLUDED.retry_at,
            dispatch_confirmed_at = CASE WHEN task_executions.dispatch_nonce = EXCLUDED.dispatch_nonce
                THEN COALESCE(EXCLUDED.dispatch_confirmed_at, task_executions.dispatch_confirmed_at)
                ELSE EXCLUDED.dispatch_confirmed_at END,
            dispatch_count = CASE WHEN task_executions.dispatch_nonce = EXCLUDED.dispatch_nonce
                THEN GREATEST(EXCLUDED.dispatch_count, task_executions.dispatch_count)
                ELSE EXCLUDED.dispatch_count END,
            dispatched_at = CASE WHEN task_executions.dispatch_nonce = EXCLUDED.dispatch_nonce
                THEN GREATEST(EXCLUDED.dispatched_at, task_executions.dispatched_at)
                ELSE EXCLUDED.dispatched_at END,
            dispatch_nonce = EXCLUDED.dispatch_nonce,
            timeout_at = EXCLUDED.timeout_at,
            satisfied_inbound = EXCLUDED.satisfied_inbound,
            ready = EXCLUDED.ready,
            transitions_fired = EXCLUDED.transitions_fired,
            updated_at = EXCLUDED.updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutionRowMapper executionRowMapper;
    private final TaskExecutionRowMapper taskExecutionRowMapper;

    public JdbcExecutionStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executionRowMapper = new ExecutionRowMapper();
        this.taskExecutionRowMapper = new TaskExecutionRowMapper();
    }

    @Override
    public Execution createExecution(DefinitionId definitionId, JsonNode input) {
        Execution execution = Execution.create(definitionId, input, clock.instant());
        String sql = """
            INSERT INTO executions (
                id, definition_name, definition_version, status, input_json,
                created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            execution.id(),
            execution.definitionName(),
            execution.definitionVersion(),
            execution.status().name(),
            toJson(execution.input()),
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.updatedAt()),
            execution.version()
        );
        return execution;
    }

    @Override
    public ExecutionSnapshot loadForUpdate(UUID executionId) {
        return transactionTemplate.execute(status -> {
            // Execution first: a commit racing between the two reads makes our own commit conflict
            Execution execution = findExecution(executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
            return new ExecutionSnapshot(execution, listTaskExecutions(executionId));
        });
    }

    @Override
    public void commit(Execution execution, Collection<TaskExecution> changedTaskExecutions) {
        transactionTemplate.executeWithoutResult(status -> {
            String sql = """
                UPDATE executions SET
                    status = ?,
                    output_json = ?::jsonb,
                    error_task = ?,
                    error_code = ?,
                    error_message = ?,
                    started_at = ?,
                    updated_at = ?,
                    completed_at = ?,
                    version = ?
                WHERE id = ? AND version = ?
                """;
            int rows = jdbcTemplate.update(sql,
                execution.status().name(),
                toJson(execution.output()),
                execution.errorTask(),
                execution.errorCode(),
                execution.errorMessage(),
                toTimestamp(execution.startedAt()),
                toTimestamp(execution.updatedAt()),
                toTimestamp(execution.completedAt()),
                execution.version(),
                execution.id(),
                execution.version() - 1
            );

            if (rows == 0) {
                List<Long> actual = jdbcTemplate.queryForList(
                    "SELECT version FROM executions WHERE id = ?", Long.class, execution.id());
                if (actual.isEmpty()) {
                    throw new NotFoundException("Execution", execution.id());
                }
                throw new ConflictException("Execution", execution.id().toString(),
                    execution.version() - 1, actual.get(0));
            }

            if (!changedTaskExecutions.isEmpty()) {
                List<Object[]> batch = new ArrayList<>(changedTaskExecutions.size());
                for (TaskExecution task : changedTaskExecutions) {
                    batch.add(toRow(task));
                }
                jdbcTemplate.batchUpdate(UPSERT_TASK_SQL, batch);
            }
            log.debug("Committed execution {} at version {} with {} task changes",
                execution.id(), execution.version(), changedTaskExecutions.size());
        });
    }

    private Object[] toRow(TaskExecution task) {
        return new Object[] {
            task.id(),
            task.executionId(),
            task.taskName(),
            task.iteration(),
            task.itemIndex(),
            task.groupId(),
            task.status().name(),
            task.attempt(),
            toJson(task.input()),
            toJson(task.result()),
            task.errorCode(),
            task.errorMessage(),
            toTimestamp(task.retryAt()),
            task.dispatchNonce(),
            toTimestamp(task.dispatchedAt()),
            toTimestamp(task.dispatchConfirmedAt()),
            task.dispatchCount(),
            toTimestamp(task.timeoutAt()),
            toJsonArray(task.satisfiedInbound()),
            task.ready(),
            task.transitionsFired(),
            toTimestamp(task.createdAt()),
            toTimestamp(task.updatedAt())
        };
    }

    // ========== Queries ==========

    @Override
    public Optional<Execution> findExecution(UUID executionId) {
        String sql = "SELECT * FROM executions WHERE id = ?";
        List<Execution> results = jdbcTemplate.query(sql, executionRowMapper, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<TaskExecution> findTaskExecution(UUID taskExecutionId) {
        String sql = "SELECT * FROM task_executions WHERE id = ?";
        List<TaskExecution> results = jdbcTemplate.query(sql, taskExecutionRowMapper, taskExecutionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TaskExecution> listTaskExecutions(UUID executionId) {
        String sql = "SELECT * FROM task_executions WHERE execution_id = ? ORDER BY seq";
        return jdbcTemplate.query(sql, taskExecutionRowMapper, executionId);
    }

    @Override
    public List<Execution> listExecutions(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM executions WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (query.definitionName() != null) {
            sql.append(" AND definition_name = ?");
            params.add(query.definitionName());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().name());
        }
        // Column and direction come from enums, never from caller text
        String column = query.sortKey().column();
        boolean descending = query.sortDirection() == ExecutionQuery.SortDirection.DESC;
        if (query.marker() != null) {
            Execution marker = findExecution(query.marker())
                .orElseThrow(() -> new NotFoundException("Execution", query.marker()));
            sql.append(" AND (").append(column).append(", id) ").append(descending ? "<" : ">").append(" (?, ?)");
            params.add(toTimestamp(query.sortKey().valueOf(marker)));
            params.add(marker.id());
        }
        String direction = descending ? " DESC" : " ASC";
        sql.append(" ORDER BY ").append(column).append(direction).append(", id").append(direction).append(" LIMIT ?");
        params.add(query.limit());

        return jdbcTemplate.query(sql.toString(), executionRowMapper, params.toArray());
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS count FROM executions GROUP BY status";
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(ExecutionStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    // ========== Sweeps ==========

    @Override
    public List<TaskExecution> findDueRetries(Instant now, int limit) {
        String sql = """
            SELECT t.* FROM task_executions t
            JOIN executions e ON e.id = t.execution_id
            WHERE t.status = 'DELAYED'
              AND t.retry_at <= ?
              AND e.status = 'RUNNING'
            ORDER BY t.retry_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, taskExecutionRowMapper, Timestamp.from(now), limit);
    }

    @Override
    public List<TaskExecution> findUnconfirmedDispatches(Instant dispatchedBefore, int limit) {
        String sql = """
            SELECT * FROM task_executions
            WHERE status = 'RUNNING'
              AND dispatch_confirmed_at IS NULL
              AND dispatched_at < ?
            ORDER BY dispatched_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, taskExecutionRowMapper, Timestamp.from(dispatchedBefore), limit);
    }

    @Override
    public List<TaskExecution> findTimedOutTasks(Instant now, int limit) {
        String sql = """
            SELECT * FROM task_executions
            WHERE status = 'RUNNING'
              AND timeout_at <= ?
            ORDER BY timeout_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, taskExecutionRowMapper, Timestamp.from(now), limit);
    }

    @Override
    public List<Execution> findUnstartedExecutions(Instant createdBefore, int limit) {
        String sql = """
            SELECT * FROM executions
            WHERE started_at IS NULL
              AND status IN ('RUNNING', 'PAUSED')
              AND created_at < ?
            ORDER BY created_at, id
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, executionRowMapper, Timestamp.from(createdBefore), limit);
    }

    // ========== Dispatch bookkeeping ==========

    @Override
    public boolean markDispatched(UUID taskExecutionId, UUID nonce, Instant at) {
        String sql = """
            UPDATE task_executions
            SET dispatch_confirmed_at = COALESCE(dispatch_confirmed_at, ?)
            WHERE id = ? AND dispatch_nonce = ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(at), taskExecutionId, nonce) > 0;
    }

    @Override
    public boolean recordDispatchAttempt(UUID taskExecutionId, UUID nonce, Instant at) {
        String sql = """
            UPDATE task_executions
            SET dispatch_count = dispatch_count + 1,
                dispatched_at = ?
            WHERE id = ? AND status = 'RUNNING' AND dispatch_nonce = ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(at), taskExecutionId, nonce) > 0;
    }

    @Override
    public boolean deleteExecution(UUID executionId) {
        // task_executions rows go with the ON DELETE CASCADE
        return jdbcTemplate.update("DELETE FROM executions WHERE id = ?", executionId) > 0;
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private String toJsonArray(Set<String> values) {
        try {
            return objectMapper.writeValueAsString(new TreeSet<>(values));
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

    private static UUID toUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }

    private JsonNode parseJsonNode(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return objectMapper.readTree(json);
    }

    private class ExecutionRowMapper implements RowMapper<Execution> {
        @Override
        public Execution mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Execution(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("definition_name"),
                    rs.getInt("definition_version"),
                    parseJsonNode(rs.getString("input_json")),
                    ExecutionStatus.valueOf(rs.getString("status")),
                    parseJsonNode(rs.getString("output_json")),
                    rs.getString("error_task"),
                    rs.getString("error_code"),
                    rs.getString("error_message"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map execution row", e);
            }
        }
    }

    private class TaskExecutionRowMapper implements RowMapper<TaskExecution> {
        @Override
        public TaskExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new TaskExecution(
                    UUID.fromString(rs.getString("id")),
                    UUID.fromString(rs.getString("execution_id")),
                    rs.getString("task_name"),
                    rs.getInt("iteration"),
                    rs.getObject("item_index", Integer.class),
                    UUID.fromString(rs.getString("group_id")),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempt"),
                    parseJsonNode(rs.getString("input_json")),
                    parseJsonNode(rs.getString("result_json")),
                    rs.getString("error_code"),
                    rs.getString("error_message"),
                    toInstant(rs.getTimestamp("retry_at")),
                    toUuid(rs.getString("dispatch_nonce")),
                    toInstant(rs.getTimestamp("dispatched_at")),
                    toInstant(rs.getTimestamp("dispatch_confirmed_at")),
                    rs.getInt("dispatch_count"),
                    toInstant(rs.getTimestamp("timeout_at")),
                    Set.copyOf(objectMapper.readValue(rs.getString("satisfied_inbound"), STRING_LIST)),
                    rs.getBoolean("ready"),
                    rs.getBoolean("transitions_fired"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task execution row", e);
            }
        }
    }
}
