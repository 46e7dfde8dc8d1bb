package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.state.SessionState;

/**
 * Packages a stuck session for a human.
 */
public interface EscalationHandler {

    EscalationContext prepare(SessionState state, String reason);
}
