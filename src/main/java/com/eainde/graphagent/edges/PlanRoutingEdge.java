package com.eainde.graphagent.edges;

import com.eainde.graphagent.context.ContextManager;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

@Component
public class PlanRoutingEdge implements SessionEdge {

    private final ContextManager contextManager;

    public PlanRoutingEdge(ContextManager contextManager) {
        this.contextManager = contextManager;
    }

    @Override
    public NodeName route(SessionState state) {
        if (contextManager.requiresEscalation(state.attempt())) {
            return NodeName.ESCALATE;
        }
        // a planning error leaves no signature and goes through evaluation
        if (state.currentSignature() == null) {
            return NodeName.EVALUATE;
        }
        return NodeName.EXECUTE_TOOL;
    }
}
