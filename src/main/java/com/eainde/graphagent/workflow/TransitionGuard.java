package com.eainde.graphagent.workflow;

import com.eainde.graphagent.edges.SessionEdge;
import com.eainde.graphagent.nodes.SessionNode;
import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.bsc.langgraph4j.action.AsyncNodeAction;

/**
 * Wraps every node and routing edge as it is added to the state graph.
 */
public interface TransitionGuard {

    /** Adds nothing: nodes and edges run as they are. */
    TransitionGuard NONE = new TransitionGuard() {
        @Override
        public AsyncNodeAction<GoalState> node(NodeName name, SessionNode node) {
            return node;
        }

        @Override
        public AsyncEdgeAction<GoalState> edge(NodeName from, SessionEdge edge) {
            return edge;
        }
    };

    AsyncNodeAction<GoalState> node(NodeName name, SessionNode node);

    AsyncEdgeAction<GoalState> edge(NodeName from, SessionEdge edge);
}
