package com.eainde.graphagent.state;

import com.eainde.graphagent.model.Answer;
import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.model.Evaluation;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.model.ToolSignature;
import lombok.Builder;

import java.util.List;

/**
 * The change a node makes to the session. Null fields leave the state
 * untouched, {@code append*} lists are added to the bounded histories and the
 * {@code clear*} flags reset a field to null.
 */
@Builder
public record StateDelta(
        SessionStatus status,
        IntentSpec intent,
        ResolvedGoalSpec resolvedGoal,
        List<EntityResolution> appendResolutions,
        ToolSignature signature,
        boolean clearSignature,
        Boolean finalStep,
        ExecutionResult lastResult,
        boolean clearLastResult,
        Evaluation evaluation,
        Diagnosis diagnosis,
        boolean clearDiagnosis,
        EscalationContext escalation,
        boolean clearEscalation,
        Suspension suspension,
        boolean clearSuspension,
        boolean clearHumanResponse,
        Answer answer,
        List<String> appendProgress,
        List<Failure> appendFailures,
        List<Artifact> appendArtifacts,
        List<String> appendContext,
        Integer retryCount,
        Integer attempt,
        Integer completedSteps
) {
    public static StateDelta empty() {
        return StateDelta.builder().build();
    }

    public static StateDelta progress(String message) {
        return StateDelta.builder().appendProgress(List.of(message)).build();
    }
}
