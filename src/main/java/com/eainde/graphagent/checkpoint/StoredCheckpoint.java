package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.state.SessionState;

/**
 * The latest checkpoint of one session: LangGraph4j's ids plus the session it carries.
 */
public record StoredCheckpoint(String checkpointId, String nodeId, String nextNodeId, SessionState state) {

    public String sessionId() {
        return state.sessionId();
    }
}
