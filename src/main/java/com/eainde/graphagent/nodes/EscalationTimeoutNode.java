package com.eainde.graphagent.nodes;

import com.eainde.graphagent.error.EscalationTimeoutException;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Log4j2
@Component
public class EscalationTimeoutNode implements SessionNode {

    private final Clock clock;

    public EscalationTimeoutNode(Clock clock) {
        this.clock = clock;
    }

    @Override
    public StateDelta process(SessionState state) {
        Instant deadline = state.suspension() == null ? null : state.suspension().deadline();
        EscalationTimeoutException timeout = new EscalationTimeoutException(state.sessionId(), deadline);
        log.warn(timeout.getMessage());
        Failure failure = new Failure(timeout.getKind(), timeout.getMessage(), NodeName.ESCALATION_TIMEOUT.name(),
                null, Map.of(), state.completedSteps(), state.attempt(), clock.instant());
        return StateDelta.builder()
                .status(SessionStatus.FAILED)
                .clearSuspension(true)
                .appendFailures(List.of(failure))
                .appendProgress(List.of("No human response before the deadline"))
                .build();
    }
}
