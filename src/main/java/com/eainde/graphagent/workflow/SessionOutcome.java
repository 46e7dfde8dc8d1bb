package com.eainde.graphagent.workflow;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.Answer;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.Suspension;

import java.time.Instant;
import java.util.List;

/**
 * What a caller gets back from the engine. Exactly one of {@code answer},
 * {@code question} or {@code error} is meaningful, depending on {@code status}.
 *
 * @param waitingAt node that will be re-entered on resume; null unless awaiting input
 */
public record SessionOutcome(
        String sessionId,
        SessionStatus status,
        Answer answer,
        String question,
        List<String> options,
        List<EntityCandidate> candidates,
        NodeName waitingAt,
        Instant deadline,
        ErrorKind errorKind,
        String error,
        List<String> progress
) {
    public SessionOutcome {
        options = options == null ? List.of() : List.copyOf(options);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        progress = progress == null ? List.of() : List.copyOf(progress);
    }

    public static SessionOutcome from(SessionState state) {
        Suspension suspension = state.isSuspended() ? state.suspension() : null;
        Failure failure = state.status() == SessionStatus.FAILED && !state.failures().isEmpty()
                ? state.failures().get(state.failures().size() - 1)
                : null;
        return new SessionOutcome(
                state.sessionId(),
                state.status(),
                state.answer(),
                suspension == null ? null : suspension.question(),
                suspension == null ? List.of() : suspension.options(),
                suspension == null ? List.of() : suspension.candidates(),
                suspension == null ? null : suspension.node(),
                suspension == null ? null : suspension.deadline(),
                failure == null ? null : failure.kind(),
                failure == null ? null : failure.message(),
                state.progress());
    }

    public static SessionOutcome failed(String sessionId, ErrorKind kind, String error) {
        return new SessionOutcome(sessionId, SessionStatus.FAILED, null, null, List.of(), List.of(), null, null,
                kind, error, List.of());
    }

    public boolean isAwaitingInput() {
        return status == SessionStatus.AWAITING_INPUT;
    }
}
