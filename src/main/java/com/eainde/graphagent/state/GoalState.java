package com.eainde.graphagent.state;

import com.eainde.graphagent.checkpoint.CheckpointMapper;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Instant;
import java.util.Map;

/**
 * Graph state of the goal workflow. The whole {@link SessionState} travels
 * under {@link #SESSION} as checkpoint JSON, so LangGraph4j can clone and
 * persist it without knowing the session types.
 */
public class GoalState extends AgentState {

    public static final String SESSION = "session";

    private static final CheckpointMapper MAPPER = new CheckpointMapper();

    private SessionState session;

    public GoalState(Map<String, Object> initData) {
        super(initData);
    }

    public SessionState session() {
        if (session == null) {
            Object json = this.data().get(SESSION);
            if (!(json instanceof String)) {
                throw new IllegalStateException("Graph state carries no session");
            }
            session = MAPPER.read("graph state", (String) json);
        }
        return session;
    }

    public static Map<String, Object> of(SessionState session) {
        return Map.of(SESSION, MAPPER.write(session));
    }

    public static SessionState decode(Map<String, Object> data) {
        return new GoalState(data).session();
    }

    /**
     * Applies a node's delta and counts the transition. A suspended session
     * rests on the node that asked the question, a terminal one on {@code END}.
     */
    public static SessionState advance(SessionState state, StateDelta delta, Instant now) {
        SessionState applied = state.apply(delta, now);
        return applied.toBuilder()
                .currentNode(restingNode(applied, state.currentNode()))
                .version(state.version() + 1)
                .build();
    }

    /**
     * Positions a checkpointed session on the node the graph will run next.
     *
     * @param nextNodeId LangGraph4j node id, {@code END} or {@code null}
     */
    public static SessionState positioned(SessionState state, String nextNodeId) {
        NodeName next = state.currentNode();
        if (nextNodeId != null) {
            for (NodeName name : NodeName.values()) {
                if (name.name().equals(nextNodeId)) {
                    next = name;
                }
            }
        }
        NodeName resting = restingNode(state, next);
        return resting == state.currentNode() ? state : state.toBuilder().currentNode(resting).build();
    }

    public static NodeName restingNode(SessionState state, NodeName fallback) {
        if (state.isSuspended()) {
            return state.suspension().node();
        }
        if (state.status().isTerminal()) {
            return NodeName.END;
        }
        return fallback;
    }
}
