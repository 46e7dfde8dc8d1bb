package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.state.SessionState;

/**
 * Chooses the next tool call for a session.
 */
public interface StepPlanner {

    /**
     * @throws com.eainde.graphagent.error.PlanningException if no valid step can be produced
     */
    PlannedStep plan(SessionState state, ModelInput input);
}
