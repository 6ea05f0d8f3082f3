package com.agentloop.core.persistence;

import com.agentloop.core.context.ContextMarkdownSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BaseCheckpointSaver} writing each session's checkpoints, oldest first, to
 * {@code <directory>/<sessionId>.json}, plus a readable {@code <sessionId>.context.md}
 * rendering of the latest context.
 * <p>
 * The JSON file is replaced atomically on every put.
 */
public class FileCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointSaver.class);

    record StoredCheckpoint(String id, String nodeId, String nextNodeId, Map<String, Object> state) {

        static StoredCheckpoint of(Checkpoint checkpoint) {
            return new StoredCheckpoint(checkpoint.getId(), checkpoint.getNodeId(),
                    checkpoint.getNextNodeId(), checkpoint.getState());
        }

        Checkpoint toCheckpoint() {
            var builder = Checkpoint.builder().id(id).state(state);
            if (nodeId != null) {
                builder.nodeId(nodeId);
            }
            if (nextNodeId != null) {
                builder.nextNodeId(nextNodeId);
            }
            return builder.build();
        }
    }

    private final Path directory;
    private final CheckpointCodec codec = new CheckpointCodec();

    public FileCheckpointSaver(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized Collection<Checkpoint> list(RunnableConfig config) {
        return read(resolveThreadId(config)).stream()
                .map(StoredCheckpoint::toCheckpoint)
                .toList();
    }

    @Override
    public synchronized Optional<Checkpoint> get(RunnableConfig config) {
        List<StoredCheckpoint> stored = read(resolveThreadId(config));
        Optional<String> checkpointId = config.checkPointId();
        if (checkpointId.isPresent()) {
            return stored.stream()
                    .filter(c -> c.id().equals(checkpointId.get()))
                    .findFirst()
                    .map(StoredCheckpoint::toCheckpoint);
        }
        return stored.isEmpty()
                ? Optional.empty()
                : Optional.of(stored.get(stored.size() - 1).toCheckpoint());
    }

    @Override
    public synchronized RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        List<StoredCheckpoint> stored = new ArrayList<>(read(threadId));
        stored.removeIf(c -> c.id().equals(checkpoint.getId()));
        stored.add(StoredCheckpoint.of(checkpoint));

        Files.createDirectories(directory);
        Path target = checkpointFile(threadId);
        Path tmp = directory.resolve(threadId + ".json.tmp");
        Files.writeString(tmp, codec.mapper().writeValueAsString(stored), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        Optional<LoopSnapshot> snapshot = LoopCheckpoints.snapshotOf(checkpoint);
        if (snapshot.isPresent() && snapshot.get().context() != null) {
            Files.writeString(directory.resolve(threadId + ".context.md"),
                    ContextMarkdownSerializer.render(threadId, snapshot.get().context()),
                    StandardCharsets.UTF_8);
        }
        log.debug("Checkpoint '{}' for {} written to {}", checkpoint.getId(), threadId, target);

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public synchronized Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);
        Files.deleteIfExists(checkpointFile(threadId));
        Files.deleteIfExists(directory.resolve(threadId + ".context.md"));
        log.debug("Released {} checkpoints for {}", released.size(), threadId);
        return new Tag(threadId, released);
    }

    private List<StoredCheckpoint> read(String threadId) {
        Path file = checkpointFile(threadId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return codec.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8),
                    new TypeReference<List<StoredCheckpoint>>() {});
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoints for session " + threadId, e);
        }
    }

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private Path checkpointFile(String threadId) {
        return directory.resolve(threadId + ".json");
    }
}
