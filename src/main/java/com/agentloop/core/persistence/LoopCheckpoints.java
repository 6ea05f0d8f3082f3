package com.agentloop.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads loop snapshots back out of any {@link BaseCheckpointSaver}.
 * <p>
 * Every graph checkpoint carries the full {@link LoopSnapshot} as JSON under
 * {@link #SNAPSHOT_KEY}; the thread id of a session's checkpoints is its session id.
 */
public final class LoopCheckpoints {

    public static final String SNAPSHOT_KEY = "snapshot";

    private static final CheckpointCodec CODEC = new CheckpointCodec();

    private LoopCheckpoints() {}

    public static RunnableConfig config(String sessionId) {
        return RunnableConfig.builder().threadId(sessionId).build();
    }

    public static String encode(LoopSnapshot snapshot) {
        return CODEC.encode(snapshot);
    }

    public static LoopSnapshot decode(String json) {
        return CODEC.decode(json);
    }

    /** The snapshot a checkpoint carries, empty for checkpoints taken before the first node ran. */
    public static Optional<LoopSnapshot> snapshotOf(Checkpoint checkpoint) {
        Object json = checkpoint.getState().get(SNAPSHOT_KEY);
        if (!(json instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(decode(text));
    }

    /** Most recent snapshot stored for a session. */
    public static Optional<LoopSnapshot> latest(BaseCheckpointSaver saver, String sessionId) {
        return saver.get(config(sessionId)).flatMap(LoopCheckpoints::snapshotOf);
    }

    /**
     * All snapshots of a session, oldest first. Savers differ in listing order, so snapshots
     * are ordered by the number of phases entered.
     */
    public static List<LoopSnapshot> history(BaseCheckpointSaver saver, String sessionId) {
        return saver.list(config(sessionId)).stream()
                .map(LoopCheckpoints::snapshotOf)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingInt(s -> s.phaseHistory().size()))
                .toList();
    }
}
