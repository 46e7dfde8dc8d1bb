package com.eainde.graphagent.nodes;

import com.eainde.graphagent.context.ContextManager;
import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.error.GraphAgentException;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.pipeline.PlannedStep;
import com.eainde.graphagent.pipeline.StepPlanner;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Plans the next tool call with as much context as the current attempt allows.
 * A planning error is recorded as a retryable validation result so it goes
 * through evaluation and diagnosis like a failed tool call.
 */
@Log4j2
@Component
public class PlanStepNode implements SessionNode {

    private final StepPlanner stepPlanner;
    private final ContextManager contextManager;
    private final Clock clock;

    public PlanStepNode(StepPlanner stepPlanner, ContextManager contextManager, Clock clock) {
        this.stepPlanner = stepPlanner;
        this.contextManager = contextManager;
        this.clock = clock;
    }

    @Override
    public StateDelta process(SessionState state) {
        int attempt = state.attempt();
        if (contextManager.requiresEscalation(attempt)) {
            return StateDelta.builder()
                    .clearSignature(true)
                    .appendProgress(List.of("Context disclosure exhausted after " + contextManager.maxAttempts()
                            + " attempts"))
                    .build();
        }

        ModelInput input = contextManager.prepareContext(state, attempt);
        try {
            PlannedStep step = stepPlanner.plan(state, input);
            log.info("Step {} planned: {} (attempt {})", state.completedSteps() + 1, step.signature().toolName(), attempt);
            return StateDelta.builder()
                    .signature(step.signature())
                    .finalStep(step.finalStep())
                    .clearLastResult(true)
                    .appendProgress(List.of("Planned " + step.signature().toolName()
                            + (step.rationale() == null ? "" : ": " + step.rationale())))
                    .build();
        } catch (GraphAgentException e) {
            log.warn("Planning failed on attempt {}: {}", attempt, e.getMessage());
            Failure failure = new Failure(e.getKind(), e.getMessage(), NodeName.PLAN_STEP.name(), null, Map.of(),
                    state.completedSteps(), attempt, clock.instant());
            return StateDelta.builder()
                    .clearSignature(true)
                    .lastResult(ExecutionResult.validationError(null, ErrorKind.VALIDATION, e.getMessage()))
                    .appendFailures(List.of(failure))
                    .appendProgress(List.of("Planning failed: " + e.getMessage()))
                    .build();
        }
    }
}
