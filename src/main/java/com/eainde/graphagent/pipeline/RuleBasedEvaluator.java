package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.Evaluation;
import com.eainde.graphagent.model.EvaluationOutcome;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.state.SessionState;

public class RuleBasedEvaluator implements Evaluator {

    @Override
    public Evaluation evaluate(SessionState state) {
        ExecutionResult result = state.lastResult();
        if (result == null) {
            return new Evaluation(EvaluationOutcome.ESCALATE, "No result to evaluate");
        }
        if (result.isSuccess()) {
            return state.finalStep()
                    ? new Evaluation(EvaluationOutcome.COMPLETE, "Final step succeeded")
                    : new Evaluation(EvaluationOutcome.ADVANCE, "Step " + (state.completedSteps() + 1) + " succeeded");
        }
        if (!result.retryable()) {
            return new Evaluation(EvaluationOutcome.ESCALATE, "Non-retryable " + result.errorKind() + ": " + result.error());
        }
        if (state.retryCount() >= state.maxRetries()) {
            return new Evaluation(EvaluationOutcome.ESCALATE,
                    "Retries exhausted (" + state.retryCount() + "/" + state.maxRetries() + ")");
        }
        return new Evaluation(EvaluationOutcome.RETRY, "Retryable " + result.errorKind() + ": " + result.error());
    }
}
