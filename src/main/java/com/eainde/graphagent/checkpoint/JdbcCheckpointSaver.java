package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.error.CheckpointException;
import com.eainde.graphagent.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoints in a {@code session_checkpoint} table, one row per session.
 * <p>
 * Written with H2/Oracle-style {@code MERGE ... KEY}. For PostgreSQL use
 * {@code INSERT ... ON CONFLICT (session_id) DO UPDATE}.
 * </p>
 */
@Log4j2
public class JdbcCheckpointSaver extends AbstractCheckpointSaver {

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS session_checkpoint (
                session_id    VARCHAR(64) PRIMARY KEY,
                checkpoint_id VARCHAR(64) NOT NULL,
                node_id       VARCHAR(64),
                next_node_id  VARCHAR(64),
                version       BIGINT NOT NULL,
                status        VARCHAR(32) NOT NULL,
                state_data    CLOB NOT NULL,
                updated_at    TIMESTAMP NOT NULL
            )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final CheckpointMapper mapper;

    public JdbcCheckpointSaver(JdbcTemplate jdbcTemplate, CheckpointMapper mapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mapper = mapper;
    }

    public void initSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        log.info("session_checkpoint table ready");
    }

    @Override
    protected void write(StoredCheckpoint checkpoint) {
        SessionState state = checkpoint.state();
        String json = mapper.write(state);
        try {
            jdbcTemplate.update("""
                    MERGE INTO session_checkpoint
                        (session_id, checkpoint_id, node_id, next_node_id, version, status, state_data, updated_at)
                    KEY (session_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                    """, state.sessionId(), checkpoint.checkpointId(), checkpoint.nodeId(), checkpoint.nextNodeId(),
                    state.version(), state.status().name(), json);
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to write checkpoint for session " + state.sessionId(), e);
        }
    }

    @Override
    protected Optional<StoredCheckpoint> read(String sessionId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT checkpoint_id, node_id, next_node_id, state_data FROM session_checkpoint WHERE session_id = ?",
                    (rs, rowNum) -> new StoredCheckpoint(
                            rs.getString("checkpoint_id"),
                            rs.getString("node_id"),
                            rs.getString("next_node_id"),
                            mapper.read(sessionId, rs.getString("state_data"))),
                    sessionId));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to read checkpoint for session " + sessionId, e);
        }
    }

    @Override
    public boolean delete(String sessionId) {
        return jdbcTemplate.update("DELETE FROM session_checkpoint WHERE session_id = ?", sessionId) > 0;
    }

    @Override
    public Set<String> sessionIds() {
        return new HashSet<>(jdbcTemplate.query(
                "SELECT session_id FROM session_checkpoint",
                (rs, rowNum) -> rs.getString("session_id")));
    }
}
