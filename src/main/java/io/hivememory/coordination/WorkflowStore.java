package io.hivememory.coordination;

import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Workflow checkpoints in {@code workflow_state}. Every save appends a row, so the
 * full step history of a workflow is kept; the newest row is the resume point.
 */
@Component
public class WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStore.class);
    private static final String COLUMNS = "id, workflow_id, step, status, checkpoint, sha, created_at";

    private final MemoryContext context;

    public WorkflowStore(MemoryContext context) {
        this.context = context;
    }

    public WorkflowCheckpoint saveCheckpoint(String workflowId, String step, String status, Object state) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new ValidationException("workflowId is required");
        }
        if (step == null || status == null) {
            throw new ValidationException("step and status are required");
        }
        context.database().ensureTable(SchemaTable.WORKFLOW_STATE);
        String json = context.toJson(state);
        String sha = sha256(json);
        long now = context.now();

        long id = context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    INSERT INTO workflow_state (workflow_id, step, status, checkpoint, sha, ttl, created_at)
                    VALUES (?, ?, ?, ?, ?, 0, ?)
                    """, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setString(1, workflowId);
                stmt.setString(2, step);
                stmt.setString(3, status);
                stmt.setString(4, json);
                stmt.setString(5, sha);
                stmt.setLong(6, now);
                stmt.executeUpdate();
                try (var keys = stmt.getGeneratedKeys()) {
                    return keys.next() ? keys.getLong(1) : 0L;
                }
            }
        });
        log.debug("Checkpoint {} for workflow {} at step {} ({})", id, workflowId, step, status);
        return new WorkflowCheckpoint(id, workflowId, step, status, context.readJson(json), sha, now);
    }

    public Optional<WorkflowCheckpoint> getLatestCheckpoint(String workflowId) {
        List<WorkflowCheckpoint> latest = select(
                "SELECT " + COLUMNS + " FROM workflow_state WHERE workflow_id = ? ORDER BY id DESC LIMIT 1",
                workflowId);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    /**
     * Latest checkpoint of a workflow that must exist.
     *
     * @throws NotFoundException no checkpoint was ever saved for {@code workflowId}
     */
    public WorkflowCheckpoint resume(String workflowId) {
        WorkflowCheckpoint checkpoint = getLatestCheckpoint(workflowId)
                .orElseThrow(() -> new NotFoundException("No checkpoint for workflow: " + workflowId));
        log.info("Resuming workflow {} from step {}", workflowId, checkpoint.step());
        return checkpoint;
    }

    /**
     * All checkpoints of a workflow, oldest first.
     */
    public List<WorkflowCheckpoint> listCheckpoints(String workflowId) {
        return select("SELECT " + COLUMNS + " FROM workflow_state WHERE workflow_id = ? ORDER BY id", workflowId);
    }

    /**
     * Latest checkpoint of every workflow whose current status is {@code status}.
     */
    public List<WorkflowCheckpoint> queryWorkflowsByStatus(String status) {
        return select("SELECT " + COLUMNS + " FROM workflow_state w WHERE status = ?"
                + " AND id = (SELECT MAX(id) FROM workflow_state WHERE workflow_id = w.workflow_id)"
                + " ORDER BY workflow_id", status);
    }

    private List<WorkflowCheckpoint> select(String sql, String parameter) {
        context.database().ensureTable(SchemaTable.WORKFLOW_STATE);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, parameter);
                return readCheckpoints(stmt.executeQuery());
            }
        });
    }

    private List<WorkflowCheckpoint> readCheckpoints(ResultSet rs) throws SQLException {
        List<WorkflowCheckpoint> checkpoints = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                checkpoints.add(new WorkflowCheckpoint(
                        rs.getLong("id"),
                        rs.getString("workflow_id"),
                        rs.getString("step"),
                        rs.getString("status"),
                        context.readJson(rs.getString("checkpoint")),
                        rs.getString("sha"),
                        rs.getLong("created_at")));
            }
        }
        return checkpoints;
    }

    static String sha256(String json) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
