package com.eainde.graphagent.nodes;

import com.eainde.graphagent.model.Evaluation;
import com.eainde.graphagent.model.EvaluationOutcome;
import com.eainde.graphagent.pipeline.Evaluator;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EvaluateNode implements SessionNode {

    private final Evaluator evaluator;

    public EvaluateNode(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public StateDelta process(SessionState state) {
        Evaluation evaluation = evaluator.evaluate(state);
        StateDelta.StateDeltaBuilder delta = StateDelta.builder()
                .evaluation(evaluation)
                .appendProgress(List.of(evaluation.outcome() + ": " + evaluation.reason()));
        if (evaluation.outcome() == EvaluationOutcome.ADVANCE || evaluation.outcome() == EvaluationOutcome.COMPLETE) {
            // retries and disclosure are accounted per step
            delta.completedSteps(state.completedSteps() + 1)
                    .retryCount(0)
                    .attempt(1)
                    .clearDiagnosis(true)
                    .clearSignature(true);
        }
        return delta.build();
    }
}
