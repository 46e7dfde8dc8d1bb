package com.eainde.graphagent.state;

import com.eainde.graphagent.model.Answer;
import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.model.Evaluation;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.model.ToolSignature;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full state of one goal session. Immutable; every change goes through
 * {@link #apply(StateDelta, Instant)} inside an orchestrator transition, and the
 * result is checkpointed so the session can resume in another process.
 */
@Builder(toBuilder = true)
public record SessionState(
        String sessionId,
        String goal,
        NodeName currentNode,
        SessionStatus status,
        IntentSpec intent,
        ResolvedGoalSpec resolvedGoal,
        List<EntityResolution> resolutions,
        ToolSignature currentSignature,
        boolean finalStep,
        ExecutionResult lastResult,
        Evaluation evaluation,
        Diagnosis diagnosis,
        EscalationContext escalation,
        Suspension suspension,
        HumanResponse humanResponse,
        Answer answer,
        List<String> progress,
        List<Failure> failures,
        List<Artifact> artifacts,
        List<String> providedContext,
        int retryCount,
        int maxRetries,
        int attempt,
        int completedSteps,
        int historyLimit,
        long version,
        Instant createdAt,
        Instant updatedAt
) {
    public SessionState {
        resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
        progress = progress == null ? List.of() : List.copyOf(progress);
        failures = failures == null ? List.of() : List.copyOf(failures);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        providedContext = providedContext == null ? List.of() : List.copyOf(providedContext);
    }

    public static SessionState start(String sessionId, String goal, int maxRetries, int historyLimit, Instant now) {
        return SessionState.builder()
                .sessionId(sessionId)
                .goal(goal)
                .currentNode(NodeName.PARSE_INTENT)
                .status(SessionStatus.RUNNING)
                .maxRetries(maxRetries)
                .historyLimit(historyLimit)
                .attempt(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public SessionState apply(StateDelta delta, Instant now) {
        SessionStateBuilder next = toBuilder().updatedAt(now);
        if (delta.status() != null) {
            next.status(delta.status());
        }
        if (delta.intent() != null) {
            next.intent(delta.intent());
        }
        if (delta.resolvedGoal() != null) {
            next.resolvedGoal(delta.resolvedGoal());
        }
        if (delta.appendResolutions() != null) {
            next.resolutions(append(resolutions, delta.appendResolutions(), historyLimit));
        }
        if (delta.clearSignature()) {
            next.currentSignature(null);
        }
        if (delta.signature() != null) {
            next.currentSignature(delta.signature());
        }
        if (delta.finalStep() != null) {
            next.finalStep(delta.finalStep());
        }
        if (delta.clearLastResult()) {
            next.lastResult(null);
        }
        if (delta.lastResult() != null) {
            next.lastResult(delta.lastResult());
        }
        if (delta.evaluation() != null) {
            next.evaluation(delta.evaluation());
        }
        if (delta.clearDiagnosis()) {
            next.diagnosis(null);
        }
        if (delta.diagnosis() != null) {
            next.diagnosis(delta.diagnosis());
        }
        if (delta.clearEscalation()) {
            next.escalation(null);
        }
        if (delta.escalation() != null) {
            next.escalation(delta.escalation());
        }
        if (delta.clearSuspension()) {
            next.suspension(null);
        }
        if (delta.suspension() != null) {
            next.suspension(delta.suspension());
        }
        if (delta.clearHumanResponse()) {
            next.humanResponse(null);
        }
        if (delta.answer() != null) {
            next.answer(delta.answer());
        }
        if (delta.appendProgress() != null) {
            next.progress(append(progress, delta.appendProgress(), historyLimit));
        }
        if (delta.appendFailures() != null) {
            next.failures(append(failures, delta.appendFailures(), historyLimit));
        }
        if (delta.appendArtifacts() != null) {
            next.artifacts(append(artifacts, delta.appendArtifacts(), historyLimit));
        }
        if (delta.appendContext() != null) {
            next.providedContext(append(providedContext, delta.appendContext(), historyLimit));
        }
        if (delta.retryCount() != null) {
            next.retryCount(delta.retryCount());
        }
        if (delta.attempt() != null) {
            next.attempt(delta.attempt());
        }
        if (delta.completedSteps() != null) {
            next.completedSteps(delta.completedSteps());
        }
        return next.build();
    }

    /** Failures recorded for the step currently being worked on. */
    @JsonIgnore
    public List<Failure> currentStepFailures() {
        return failures.stream().filter(f -> f.stepIndex() == completedSteps).toList();
    }

    @JsonIgnore
    public boolean isSuspended() {
        return status == SessionStatus.AWAITING_INPUT && suspension != null;
    }

    /** Appends and drops the oldest entries beyond {@code limit}; a limit below one keeps everything. */
    static <T> List<T> append(List<T> existing, List<T> additions, int limit) {
        List<T> combined = new ArrayList<>(existing);
        combined.addAll(additions);
        if (limit > 0 && combined.size() > limit) {
            return combined.subList(combined.size() - limit, combined.size());
        }
        return combined;
    }
}
