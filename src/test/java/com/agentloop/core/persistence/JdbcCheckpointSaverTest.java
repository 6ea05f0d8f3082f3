package com.agentloop.core.persistence;

import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.SessionResult;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCheckpointSaverTest {

    private JdbcCheckpointSaver saver;

    @BeforeEach
    void setUp() throws SQLException {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:checkpoints-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        saver = new JdbcCheckpointSaver(dataSource);
        saver.createTables();
    }

    @Test
    @DisplayName("keeps a row per checkpoint in insertion order and returns the latest")
    void historyAndLatest() {
        SessionResult result = SnapshotFixtures.runSession("JDBC-1", saver);
        RunnableConfig config = LoopCheckpoints.config("JDBC-1");

        List<Checkpoint> rows = new ArrayList<>(saver.list(config));
        assertTrue(rows.size() >= result.phaseHistory().size());
        assertEquals(rows.get(rows.size() - 1).getId(), saver.get(config).orElseThrow().getId());

        LoopSnapshot latest = LoopCheckpoints.latest(saver, "JDBC-1").orElseThrow();
        assertEquals(LoopPhase.DONE, latest.phase());
        assertEquals(result.phaseHistory(), latest.phaseHistory());
        assertEquals("fetched https://example.org", latest.graph().nodes().get(0).result());
        assertEquals(LoopPhase.PLANNING, LoopCheckpoints.snapshotOf(rows.get(0)).orElseThrow().phase());
    }

    @Test
    @DisplayName("putting the same checkpoint twice replaces its row")
    void putIsIdempotentPerCheckpoint() throws Exception {
        SnapshotFixtures.runSession("JDBC-2", saver);
        RunnableConfig config = LoopCheckpoints.config("JDBC-2");
        Checkpoint latest = saver.get(config).orElseThrow();
        int rows = saver.list(config).size();

        RunnableConfig updated = saver.put(config, latest);

        assertEquals(rows, saver.list(config).size());
        assertEquals(latest.getId(), updated.checkPointId().orElseThrow());
        assertEquals(latest.getNodeId(), saver.get(updated).orElseThrow().getNodeId());
    }

    @Test
    @DisplayName("sessions are isolated, unknown ones are empty and release deletes")
    void isolationAndRelease() throws Exception {
        SnapshotFixtures.runSession("JDBC-3", saver);
        saver.createTables();

        assertTrue(saver.get(LoopCheckpoints.config("JDBC-4")).isEmpty());
        assertTrue(saver.list(LoopCheckpoints.config("JDBC-4")).isEmpty());

        int stored = saver.list(LoopCheckpoints.config("JDBC-3")).size();
        var tag = saver.release(LoopCheckpoints.config("JDBC-3"));

        assertEquals(stored, tag.checkpoints().size());
        assertTrue(saver.list(LoopCheckpoints.config("JDBC-3")).isEmpty());
    }
}
