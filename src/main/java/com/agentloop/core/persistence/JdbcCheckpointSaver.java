package com.agentloop.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link BaseCheckpointSaver} keeping every graph checkpoint of a session as a JSON row.
 * <p>
 * Rows are keyed by {@code (thread_id, checkpoint_id)}; the identity column {@code seq}
 * keeps insertion order, so the latest checkpoint is the one with the highest {@code seq}.
 * The SQL sticks to what H2 and PostgreSQL both accept. The table
 * {@code agentloop_checkpoints} is created by {@link #createTables()}.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    private static final String TABLE_NAME = "agentloop_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY,
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         TEXT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET node_id = ?, next_node_id = ?, state = ?, created_at = CURRENT_TIMESTAMP
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq DESC
            FETCH FIRST 1 ROWS ONLY
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_THREAD_SQL = """
            DELETE FROM %s WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final CheckpointCodec codec = new CheckpointCodec();

    public JdbcCheckpointSaver(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        List<Checkpoint> checkpoints = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpoints for session " + threadId, e);
        }
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        Optional<String> checkpointId = config.checkPointId();
        String sql = checkpointId.isPresent() ? SELECT_BY_ID_SQL : SELECT_LATEST_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (checkpointId.isPresent()) {
                stmt.setString(2, checkpointId.get());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to get checkpoint for session '{}', id '{}'",
                    threadId, checkpointId.orElse("latest"), e);
            throw new CheckpointException("Failed to load checkpoint for session " + threadId, e);
        }
        return Optional.empty();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        String state = codec.writeState(checkpoint.getState());

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {
                update.setString(1, checkpoint.getNodeId());
                update.setString(2, checkpoint.getNextNodeId());
                update.setString(3, state);
                update.setString(4, threadId);
                update.setString(5, checkpoint.getId());
                if (update.executeUpdate() == 0) {
                    try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                        insert.setString(1, threadId);
                        insert.setString(2, checkpoint.getId());
                        insert.setString(3, checkpoint.getNodeId());
                        insert.setString(4, checkpoint.getNextNodeId());
                        insert.setString(5, state);
                        insert.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
        log.debug("Saved checkpoint '{}' after node '{}' for session '{}'",
                checkpoint.getId(), checkpoint.getNodeId(), threadId);

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for session '{}'", deleted, threadId);
        }
        return new Tag(threadId, released);
    }

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        String nodeId = rs.getString("node_id");
        String nextNodeId = rs.getString("next_node_id");

        var builder = Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(codec.readState(rs.getString("state")));
        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }
        return builder.build();
    }
}
