package com.eainde.graphagent.edges;

import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

@Component
public class EscalationRoutingEdge implements SessionEdge {

    @Override
    public NodeName route(SessionState state) {
        HumanResponse response = state.humanResponse();
        if (state.status() == SessionStatus.ABORTED) {
            return NodeName.END;
        }
        if (response == null || state.isSuspended()) {
            return NodeName.ESCALATE;
        }
        switch (response.kind()) {
            case CORRECTED_SIGNATURE:
                return NodeName.EXECUTE_TOOL;
            case ABORT:
                return NodeName.END;
            default:
                // nothing was understood yet, so start over from the goal
                return state.resolvedGoal() == null ? NodeName.PARSE_INTENT : NodeName.PLAN_STEP;
        }
    }
}
