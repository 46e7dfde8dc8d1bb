package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.state.SessionState;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.Optional;
import java.util.Set;

/**
 * LangGraph4j checkpoint saver keyed by session id (the graph's thread id),
 * keeping only the latest checkpoint per session. Last writer wins.
 */
public interface CheckpointSaver extends BaseCheckpointSaver {

    /**
     * Writes a session outside a graph run, e.g. when it is created or aborted.
     *
     * @throws com.eainde.graphagent.error.CheckpointException if the state cannot be written
     */
    void save(SessionState state);

    Optional<SessionState> load(String sessionId);

    boolean delete(String sessionId);

    Set<String> sessionIds();
}
