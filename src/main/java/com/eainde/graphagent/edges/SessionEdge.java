package com.eainde.graphagent.edges;

import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Picks the next node from the state after the source node's delta was
 * applied. Suspended and terminal sessions always leave the graph; the route
 * key is the {@link NodeName}.
 */
@FunctionalInterface
public interface SessionEdge extends AsyncEdgeAction<GoalState> {

    NodeName route(SessionState state);

    @Override
    default CompletableFuture<String> apply(GoalState state) {
        SessionState session = state.session();
        if (session.isSuspended() || session.status().isTerminal()) {
            return CompletableFuture.completedFuture(NodeName.END.name());
        }
        return CompletableFuture.completedFuture(route(session).name());
    }
}
