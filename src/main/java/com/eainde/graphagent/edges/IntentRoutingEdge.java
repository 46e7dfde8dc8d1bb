package com.eainde.graphagent.edges;

import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

@Component
public class IntentRoutingEdge implements SessionEdge {

    @Override
    public NodeName route(SessionState state) {
        IntentSpec intent = state.intent();
        if (intent == null || (intent.intentType() == IntentType.UNKNOWN && intent.mentions().isEmpty())) {
            return NodeName.ESCALATE;
        }
        return NodeName.RESOLVE_ENTITIES;
    }
}
