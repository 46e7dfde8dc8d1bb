package com.eainde.graphagent.nodes;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.pipeline.EscalationHandler;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import com.eainde.graphagent.state.Suspension;
import com.eainde.graphagent.state.SuspensionKind;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Hands a stuck session to a human and applies the answer on resume. The
 * response stays on the state so the routing edge can act on its kind.
 */
@Log4j2
@Component
public class EscalateNode implements SessionNode {

    private final EscalationHandler escalationHandler;
    private final Clock clock;

    public EscalateNode(EscalationHandler escalationHandler, Clock clock) {
        this.escalationHandler = escalationHandler;
        this.clock = clock;
    }

    @Override
    public StateDelta process(SessionState state) {
        HumanResponse response = state.humanResponse();
        if (state.suspension() == null || response == null) {
            return suspend(state, reasonFor(state));
        }

        StateDelta.StateDeltaBuilder resumed = StateDelta.builder()
                .status(SessionStatus.RUNNING)
                .clearSuspension(true)
                .clearEscalation(true);
        switch (response.kind()) {
            case ABORT:
                return resumed.status(SessionStatus.ABORTED)
                        .appendProgress(List.of("Aborted by user during escalation"))
                        .build();
            case CORRECTED_SIGNATURE:
                if (response.correctedSignature() == null) {
                    return suspend(state, "A corrected tool call was announced but not provided");
                }
                return resetRetries(resumed)
                        .signature(response.correctedSignature())
                        .finalStep(state.finalStep() || state.resolvedGoal() == null)
                        .appendProgress(List.of("User corrected the call to " + response.correctedSignature().toolName()))
                        .build();
            case PROVIDE_CONTEXT:
                if (response.context() == null || response.context().isBlank()) {
                    return suspend(state, "Context was announced but empty");
                }
                return resetRetries(resumed)
                        .appendContext(List.of(response.context()))
                        .appendProgress(List.of("User provided additional context"))
                        .build();
            default:
                return resetRetries(resumed)
                        .appendProgress(List.of("User asked to retry (" + response.kind() + ")"))
                        .build();
        }
    }

    private static StateDelta.StateDeltaBuilder resetRetries(StateDelta.StateDeltaBuilder delta) {
        return delta.retryCount(0).attempt(1).clearDiagnosis(true);
    }

    private StateDelta suspend(SessionState state, String reason) {
        EscalationContext context = escalationHandler.prepare(state, reason);
        Instant now = clock.instant();
        log.warn("Escalating: {}", reason);
        Suspension suspension = new Suspension(SuspensionKind.ESCALATION, NodeName.ESCALATE,
                reason, context.options(), List.of(), context.deadline(), now);
        return StateDelta.builder()
                .status(SessionStatus.AWAITING_INPUT)
                .escalation(context)
                .suspension(suspension)
                .clearHumanResponse(true)
                .appendProgress(List.of("Escalated: " + reason))
                .build();
    }

    static String reasonFor(SessionState state) {
        if (state.intent() == null
                || (state.intent().intentType() == IntentType.UNKNOWN && state.intent().mentions().isEmpty())) {
            return "The goal could not be interpreted";
        }
        List<Failure> failures = state.failures();
        Failure latest = failures.isEmpty() ? null : failures.get(failures.size() - 1);
        if (latest != null && latest.kind() == ErrorKind.INTERNAL) {
            return "Internal error in " + latest.node() + ": " + latest.message();
        }
        if (state.diagnosis() != null && state.retryCount() >= state.maxRetries()) {
            return "Retries exhausted after " + state.diagnosis().classification() + " failures";
        }
        if (state.evaluation() != null && state.lastResult() != null && !state.lastResult().isSuccess()) {
            return state.evaluation().reason();
        }
        return "Planning could not make progress with the available context";
    }
}
