package com.eainde.graphagent.edges;

import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

@Component
public class EvaluationRoutingEdge implements SessionEdge {

    @Override
    public NodeName route(SessionState state) {
        if (state.evaluation() == null) {
            return NodeName.ESCALATE;
        }
        return switch (state.evaluation().outcome()) {
            case ADVANCE -> NodeName.PLAN_STEP;
            case COMPLETE -> NodeName.ANSWER;
            case RETRY -> NodeName.DIAGNOSE;
            case ESCALATE -> NodeName.ESCALATE;
        };
    }
}
