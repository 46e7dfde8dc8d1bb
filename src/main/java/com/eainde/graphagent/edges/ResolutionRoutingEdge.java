package com.eainde.graphagent.edges;

import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

/**
 * Shared by entity resolution and disambiguation: ask while anything is
 * ambiguous, run a direct call when one was mapped, plan otherwise.
 */
@Component
public class ResolutionRoutingEdge implements SessionEdge {

    @Override
    public NodeName route(SessionState state) {
        if (state.status() == SessionStatus.ABORTED) {
            return NodeName.END;
        }
        if (state.resolvedGoal() != null && !state.resolvedGoal().pendingAmbiguities().isEmpty()) {
            return NodeName.DISAMBIGUATE;
        }
        if (state.currentSignature() != null) {
            return NodeName.EXECUTE_TOOL;
        }
        return NodeName.PLAN_STEP;
    }
}
