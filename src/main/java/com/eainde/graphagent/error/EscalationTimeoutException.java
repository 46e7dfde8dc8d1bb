package com.eainde.graphagent.error;

import java.time.Instant;

/**
 * Raised when human input is submitted for a session whose escalation deadline already passed.
 */
public class EscalationTimeoutException extends GraphAgentException {

    private final String sessionId;
    private final Instant deadline;

    public EscalationTimeoutException(String sessionId, Instant deadline) {
        super(ErrorKind.TIMEOUT, "Human input for session " + sessionId + " was not received before " + deadline);
        this.sessionId = sessionId;
        this.deadline = deadline;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
