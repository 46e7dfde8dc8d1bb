package com.eainde.graphagent.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps checkpoints as JSON strings, so a resumed session sees exactly what a
 * database-backed store would give back.
 */
public class InMemoryCheckpointSaver extends AbstractCheckpointSaver {

    private record Row(String checkpointId, String nodeId, String nextNodeId, String json) {
    }

    private final Map<String, Row> storage = new ConcurrentHashMap<>();
    private final CheckpointMapper mapper;

    public InMemoryCheckpointSaver() {
        this(new CheckpointMapper());
    }

    public InMemoryCheckpointSaver(CheckpointMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    protected void write(StoredCheckpoint checkpoint) {
        storage.put(checkpoint.sessionId(), new Row(checkpoint.checkpointId(), checkpoint.nodeId(),
                checkpoint.nextNodeId(), mapper.write(checkpoint.state())));
    }

    @Override
    protected Optional<StoredCheckpoint> read(String sessionId) {
        Row row = storage.get(sessionId);
        if (row == null) {
            return Optional.empty();
        }
        return Optional.of(new StoredCheckpoint(row.checkpointId(), row.nodeId(), row.nextNodeId(),
                mapper.read(sessionId, row.json())));
    }

    @Override
    public boolean delete(String sessionId) {
        return storage.remove(sessionId) != null;
    }

    @Override
    public Set<String> sessionIds() {
        return Set.copyOf(storage.keySet());
    }
}
