package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.state.SessionState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class DefaultEscalationHandler implements EscalationHandler {

    public static final String RETRY = "Retry with different approach";
    public static final String PROVIDE_CONTEXT = "Provide additional context";
    public static final String CORRECT_CALL = "Correct the tool call";
    public static final String ABORT = "Abort execution";

    private static final List<String> OPTIONS = List.of(RETRY, PROVIDE_CONTEXT, CORRECT_CALL, ABORT);

    private final Clock clock;
    private final Duration timeout;
    private final int maxOptions;

    /**
     * @param timeout how long a human has to answer; null for no deadline
     */
    public DefaultEscalationHandler(Clock clock, Duration timeout, int maxOptions) {
        this.clock = clock;
        this.timeout = timeout;
        this.maxOptions = Math.max(1, maxOptions);
    }

    @Override
    public EscalationContext prepare(SessionState state, String reason) {
        List<Failure> failures = state.failures();
        Failure latest = failures.isEmpty() ? null : failures.get(failures.size() - 1);

        StringBuilder summary = new StringBuilder("Goal: ").append(state.goal())
                .append("\nCompleted steps: ").append(state.completedSteps())
                .append("\nRetries: ").append(state.retryCount()).append('/').append(state.maxRetries());
        if (latest != null) {
            summary.append("\nLast error (").append(latest.kind()).append(" in ").append(latest.node())
                    .append("): ").append(latest.message());
        }
        if (state.diagnosis() != null) {
            summary.append("\nDiagnosis: ").append(state.diagnosis().reason());
        }

        Instant deadline = timeout == null ? null : clock.instant().plus(timeout);
        return new EscalationContext(reason, summary.toString(),
                OPTIONS.subList(0, Math.min(maxOptions, OPTIONS.size())),
                recommend(state, latest),
                state.currentNode() == null ? null : state.currentNode().name(),
                state.currentSignature(),
                deadline);
    }

    private static String recommend(SessionState state, Failure latest) {
        if (state.diagnosis() != null && state.diagnosis().classification() == FailureClassification.IDENTICAL) {
            return PROVIDE_CONTEXT;
        }
        if (latest != null && (latest.kind() == ErrorKind.NOT_FOUND || latest.kind() == ErrorKind.CONSTRAINT_VIOLATION
                || latest.kind() == ErrorKind.VALIDATION)) {
            return CORRECT_CALL;
        }
        return RETRY;
    }
}
