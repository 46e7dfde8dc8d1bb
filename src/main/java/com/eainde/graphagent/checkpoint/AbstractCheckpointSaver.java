package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.SessionState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps LangGraph4j checkpoints onto one {@link StoredCheckpoint} per session.
 * A checkpoint written mid-run is positioned on the node the graph runs next,
 * so a loaded session always says where it will continue.
 */
public abstract class AbstractCheckpointSaver implements CheckpointSaver {

    protected abstract void write(StoredCheckpoint checkpoint);

    protected abstract Optional<StoredCheckpoint> read(String sessionId);

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        return get(config).map(List::of).orElse(List.of());
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        return config.threadId()
                .flatMap(this::read)
                .map(stored -> Checkpoint.builder()
                        .id(stored.checkpointId())
                        .state(GoalState.of(stored.state()))
                        .nodeId(stored.nodeId())
                        .nextNodeId(stored.nextNodeId())
                        .build());
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );
        SessionState session = GoalState.positioned(GoalState.decode(checkpoint.getState()), checkpoint.getNextNodeId());
        if (!threadId.equals(session.sessionId())) {
            throw new IllegalArgumentException("Checkpoint of session " + session.sessionId()
                    + " written under thread " + threadId);
        }
        write(new StoredCheckpoint(checkpoint.getId(), checkpoint.getNodeId(), checkpoint.getNextNodeId(), session));

        return RunnableConfig.builder()
                .threadId(threadId)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );
        Collection<Checkpoint> released = list(config);
        delete(threadId);
        return new Tag(threadId, released);
    }

    @Override
    public void save(SessionState state) {
        if (state.sessionId() == null) {
            throw new IllegalArgumentException("Session ID is required");
        }
        String node = String.valueOf(state.currentNode());
        write(new StoredCheckpoint(UUID.randomUUID().toString(), node, node, state));
    }

    @Override
    public Optional<SessionState> load(String sessionId) {
        return read(sessionId).map(StoredCheckpoint::state);
    }
}
