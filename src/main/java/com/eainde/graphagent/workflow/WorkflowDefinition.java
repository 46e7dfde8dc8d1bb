package com.eainde.graphagent.workflow;

import com.eainde.graphagent.edges.SessionEdge;
import com.eainde.graphagent.nodes.SessionNode;
import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Builds the LangGraph4j state graph a session runs on.
 * <p>
 * Node ids are {@link NodeName} names. The entry edge jumps straight to the
 * session's current node, so one graph serves a fresh start, a resume and an
 * expiry alike. Every routing edge may also leave for {@code ESCALATE}, where
 * a failed node is recovered, and for {@code END}, where suspended and
 * terminal sessions go.
 * </p>
 */
@FunctionalInterface
public interface WorkflowDefinition {

    StateGraph<GoalState> define(TransitionGuard guard) throws GraphStateException;

    static void addNode(StateGraph<GoalState> graph, TransitionGuard guard, NodeName name, SessionNode node)
            throws GraphStateException {
        graph.addNode(name.name(), guard.node(name, node));
    }

    static void addRoutes(StateGraph<GoalState> graph, TransitionGuard guard, NodeName from, SessionEdge edge,
                          NodeName... targets) throws GraphStateException {
        Map<String, String> mapping = new HashMap<>();
        for (NodeName target : targets) {
            mapping.put(target.name(), nodeId(target));
        }
        mapping.put(NodeName.ESCALATE.name(), NodeName.ESCALATE.name());
        mapping.put(NodeName.END.name(), END);
        graph.addConditionalEdges(from.name(), guard.edge(from, edge), mapping);
    }

    /**
     * Routes from {@code START} to whichever of {@code nodes} the session is on.
     */
    static void addEntry(StateGraph<GoalState> graph, NodeName... nodes) throws GraphStateException {
        Map<String, String> mapping = new HashMap<>();
        for (NodeName node : nodes) {
            mapping.put(node.name(), nodeId(node));
        }
        AsyncEdgeAction<GoalState> entry =
                state -> CompletableFuture.completedFuture(state.session().currentNode().name());
        graph.addConditionalEdges(START, entry, mapping);
    }

    static String nodeId(NodeName name) {
        return name == NodeName.END ? END : name.name();
    }
}
