package com.eainde.graphagent.edges;

import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.springframework.stereotype.Component;

/**
 * Recurring failures escalate once the step's retries are used up; anything
 * else goes back to planning with more context.
 */
@Component
public class DiagnosisRoutingEdge implements SessionEdge {

    @Override
    public NodeName route(SessionState state) {
        Diagnosis diagnosis = state.diagnosis();
        boolean recurring = diagnosis != null
                && (diagnosis.classification() == FailureClassification.IDENTICAL
                || diagnosis.classification() == FailureClassification.SYSTEMATIC);
        if (recurring && state.retryCount() >= state.maxRetries()) {
            return NodeName.ESCALATE;
        }
        return NodeName.PLAN_STEP;
    }
}
