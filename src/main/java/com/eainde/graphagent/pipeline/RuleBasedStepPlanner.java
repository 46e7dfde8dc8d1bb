package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.PlanningException;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.state.SessionState;

import java.util.List;

/**
 * Plans from the resolved goal alone; the disclosed context is ignored, so a
 * retry proposes the same call again.
 */
public class RuleBasedStepPlanner implements StepPlanner {

    private final DirectStepMapper mapper;

    public RuleBasedStepPlanner(DirectStepMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public PlannedStep plan(SessionState state, ModelInput input) {
        if (state.resolvedGoal() == null) {
            throw new PlanningException("Goal has not been resolved yet");
        }
        List<ToolSignature> steps = mapper.steps(state.resolvedGoal());
        int index = state.completedSteps();
        if (index >= steps.size()) {
            throw new PlanningException("No steps left: " + index + " of " + steps.size() + " completed");
        }
        return new PlannedStep(steps.get(index), index == steps.size() - 1,
                "Step " + (index + 1) + " of " + steps.size());
    }
}
