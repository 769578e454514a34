package com.agentkernel.engine.persistence.jdbc;

import com.agentkernel.core.exception.DuplicateTaskException;
import com.agentkernel.core.exception.MalformedTaskException;
import com.agentkernel.core.model.CheckResult;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.model.TaskPriority;
import com.agentkernel.core.repository.TaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of TaskRepository.
 * The claim and every later mutation are a single conditional UPDATE on
 * (id, queue, version), so concurrent orchestrators sharing the database
 * can never both win the same row.
 */
@Repository
@ConditionalOnProperty(name = "kernel.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final String CLAIM_ORDER = " ORDER BY priority, created_at, id";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRowMapper();
    }

    @Override
    @Transactional
    public void save(Task task) {
        String sql = """
            INSERT INTO tasks (
                id, title, role, cluster, flow,
                queue, priority, version,
                claimed_by, claimed_at, lease_expires_at, orchestrator_id, claim_source,
                attempt_count, rejection_count,
                checks, check_results,
                blocked_by, branch, pr_reference, needs_rebase, last_error,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                task.id(),
                task.title(),
                task.role(),
                task.cluster(),
                task.flow(),
                task.queue(),
                task.priority().ordinal(),
                task.version(),
                task.claimedBy(),
                toTimestamp(task.claimedAt()),
                toTimestamp(task.leaseExpiresAt()),
                task.orchestratorId(),
                task.claimSource(),
                task.attemptCount(),
                task.rejectionCount(),
                toJson(task.checks()),
                checkResultsToJson(task.checkResults()),
                task.blockedBy(),
                task.branch(),
                task.prReference(),
                task.needsRebase(),
                task.lastError(),
                toTimestamp(task.createdAt()),
                toTimestamp(task.updatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateTaskException(task.id());
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";
        List<Task> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Task> find(TaskFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        appendEquals(sql, args, "queue", filter.queue());
        appendEquals(sql, args, "role", filter.role());
        appendEquals(sql, args, "cluster", filter.cluster());
        appendEquals(sql, args, "claimed_by", filter.claimedBy());
        appendEquals(sql, args, "orchestrator_id", filter.orchestratorId());
        sql.append(" ORDER BY created_at, id LIMIT ?");
        args.add(filter.limit());
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    public List<Task> findClaimCandidates(String queue, String role, String cluster, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE queue = ? AND claimed_by IS NULL");
        List<Object> args = new ArrayList<>();
        args.add(queue);
        appendEquals(sql, args, "role", role);
        appendEquals(sql, args, "cluster", cluster);
        sql.append(CLAIM_ORDER).append(" LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    @Transactional
    public Optional<Task> compareAndSet(Task updated, String expectedQueue, long expectedVersion) {
        String sql = """
            UPDATE tasks SET
                queue = ?,
                priority = ?,
                version = version + 1,
                claimed_by = ?,
                claimed_at = ?,
                lease_expires_at = ?,
                orchestrator_id = ?,
                claim_source = ?,
                attempt_count = ?,
                rejection_count = ?,
                checks = ?::jsonb,
                check_results = ?::jsonb,
                blocked_by = ?,
                branch = ?,
                pr_reference = ?,
                needs_rebase = ?,
                last_error = ?,
                updated_at = ?
            WHERE id = ? AND queue = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            updated.queue(),
            updated.priority().ordinal(),
            updated.claimedBy(),
            toTimestamp(updated.claimedAt()),
            toTimestamp(updated.leaseExpiresAt()),
            updated.orchestratorId(),
            updated.claimSource(),
            updated.attemptCount(),
            updated.rejectionCount(),
            toJson(updated.checks()),
            checkResultsToJson(updated.checkResults()),
            updated.blockedBy(),
            updated.branch(),
            updated.prReference(),
            updated.needsRebase(),
            updated.lastError(),
            toTimestamp(updated.updatedAt()),
            updated.id(),
            expectedQueue,
            expectedVersion
        );

        if (rows == 0) {
            log.debug("Conditional update missed for task {}: expected queue {} version {}",
                updated.id(), expectedQueue, expectedVersion);
            return Optional.empty();
        }
        return Optional.of(updated.withVersion(expectedVersion + 1));
    }

    @Override
    public List<Task> findExpiredClaims(Instant now, int limit) {
        String sql = """
            SELECT * FROM tasks
            WHERE claimed_by IS NOT NULL AND lease_expires_at < ?
            ORDER BY lease_expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, toTimestamp(now), limit);
    }

    @Override
    public long countByQueue(String queue) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM tasks WHERE queue = ?", Long.class, queue);
        return count != null ? count : 0L;
    }

    private static void appendEquals(StringBuilder sql, List<Object> args, String column, Object value) {
        if (value != null) {
            sql.append(" AND ").append(column).append(" = ?");
            args.add(value);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MalformedTaskException("Failed to serialize task field", e);
        }
    }

    private String checkResultsToJson(Map<String, CheckResult> results) {
        ObjectNode root = objectMapper.createObjectNode();
        results.forEach((check, result) -> {
            ObjectNode node = root.putObject(check);
            node.put("status", result.status().wireName());
            node.put("summary", result.summary());
            node.put("recordedAt", result.recordedAt() != null ? result.recordedAt().toString() : null);
        });
        return root.toString();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Task.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .role(rs.getString("role"))
                .cluster(rs.getString("cluster"))
                .flow(rs.getString("flow"))
                .queue(rs.getString("queue"))
                .priority(TaskPriority.values()[rs.getInt("priority")])
                .version(rs.getLong("version"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(toInstant(rs.getTimestamp("claimed_at")))
                .leaseExpiresAt(toInstant(rs.getTimestamp("lease_expires_at")))
                .orchestratorId(rs.getString("orchestrator_id"))
                .claimSource(rs.getString("claim_source"))
                .attemptCount(rs.getInt("attempt_count"))
                .rejectionCount(rs.getInt("rejection_count"))
                .checks(parseChecks(rs.getString("checks")))
                .checkResults(parseCheckResults(rs.getString("check_results")))
                .blockedBy(rs.getString("blocked_by"))
                .branch(rs.getString("branch"))
                .prReference(rs.getString("pr_reference"))
                .needsRebase(rs.getBoolean("needs_rebase"))
                .lastError(rs.getString("last_error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
        }

        private List<String> parseChecks(String json) {
            if (json == null) {
                return List.of();
            }
            try {
                return objectMapper.readValue(json, new TypeReference<List<String>>() {});
            } catch (JsonProcessingException e) {
                throw new MalformedTaskException("Unreadable checks column: " + json, e);
            }
        }

        private Map<String, CheckResult> parseCheckResults(String json) {
            Map<String, CheckResult> results = new LinkedHashMap<>();
            if (json == null) {
                return results;
            }
            try {
                JsonNode root = objectMapper.readTree(json);
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    JsonNode node = entry.getValue();
                    String recordedAt = node.path("recordedAt").asText(null);
                    results.put(entry.getKey(), new CheckResult(
                        CheckStatus.parse(node.path("status").asText()),
                        node.path("summary").asText(null),
                        recordedAt != null ? Instant.parse(recordedAt) : null
                    ));
                }
                return results;
            } catch (JsonProcessingException e) {
                throw new MalformedTaskException("Unreadable check_results column: " + json, e);
            }
        }
    }
}
