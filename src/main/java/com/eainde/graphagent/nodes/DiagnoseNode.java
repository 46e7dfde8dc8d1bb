package com.eainde.graphagent.nodes;

import com.eainde.graphagent.context.ContextManager;
import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.pipeline.Diagnoser;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies the current step's failures, counts the retry and raises the
 * disclosure level for the next planning attempt.
 */
@Log4j2
@Component
public class DiagnoseNode implements SessionNode {

    private final Diagnoser diagnoser;
    private final ContextManager contextManager;

    public DiagnoseNode(Diagnoser diagnoser, ContextManager contextManager) {
        this.diagnoser = diagnoser;
        this.contextManager = contextManager;
    }

    @Override
    public StateDelta process(SessionState state) {
        Diagnosis diagnosis = diagnoser.classify(state.currentStepFailures());
        int retries = state.retryCount() + 1;
        int nextAttempt = diagnosis.classification() == FailureClassification.SYSTEMATIC
                ? Math.max(state.attempt() + 1, contextManager.maxAttempts())
                : state.attempt() + 1;
        log.info("Diagnosis {} -> {} (retry {}/{}, next attempt {})", diagnosis.classification(),
                diagnosis.remediation(), retries, state.maxRetries(), nextAttempt);
        return StateDelta.builder()
                .diagnosis(diagnosis)
                .retryCount(retries)
                .attempt(nextAttempt)
                .clearSignature(true)
                .appendProgress(List.of(diagnosis.classification() + " failure, " + diagnosis.remediation()
                        + ": " + diagnosis.reason()))
                .build();
    }
}
