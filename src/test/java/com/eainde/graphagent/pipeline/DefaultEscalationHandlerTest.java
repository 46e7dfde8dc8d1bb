package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.EscalationContext;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.model.Remediation;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultEscalationHandlerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private final SessionState stuck = SessionState.start("s", "Link 'Alice' to 'Acme'", 3, 100, NOW).toBuilder()
            .currentNode(NodeName.ESCALATE)
            .retryCount(3)
            .currentSignature(ToolSignature.of("add_edge", Map.of("type", "WORKS_AT")))
            .failures(List.of(new Failure(ErrorKind.NOT_FOUND, "Target missing", "EXECUTE_TOOL", "add_edge",
                    Map.of(), 0, 2, NOW)))
            .build();

    @Test
    void prepare_shouldSummarizeTheSessionWithADeadline() {
        DefaultEscalationHandler handler = new DefaultEscalationHandler(clock, Duration.ofHours(1), 4);

        EscalationContext context = handler.prepare(stuck, "Retries exhausted");

        assertThat(context.reason()).isEqualTo("Retries exhausted");
        assertThat(context.summary())
                .contains("Goal: Link 'Alice' to 'Acme'")
                .contains("Retries: 3/3")
                .contains("Last error (NOT_FOUND in EXECUTE_TOOL): Target missing");
        assertThat(context.options()).containsExactly(DefaultEscalationHandler.RETRY,
                DefaultEscalationHandler.PROVIDE_CONTEXT, DefaultEscalationHandler.CORRECT_CALL,
                DefaultEscalationHandler.ABORT);
        assertThat(context.recommendedOption()).isEqualTo(DefaultEscalationHandler.CORRECT_CALL);
        assertThat(context.requestingNode()).isEqualTo("ESCALATE");
        assertThat(context.failedSignature().toolName()).isEqualTo("add_edge");
        assertThat(context.deadline()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void prepare_shouldRecommendContextForIdenticalFailuresAndCapOptions() {
        DefaultEscalationHandler handler = new DefaultEscalationHandler(clock, null, 2);
        SessionState identical = stuck.toBuilder()
                .diagnosis(new Diagnosis(FailureClassification.IDENTICAL, Remediation.ESCALATE_SOON, "same error"))
                .build();

        EscalationContext context = handler.prepare(identical, "stuck");

        assertThat(context.recommendedOption()).isEqualTo(DefaultEscalationHandler.PROVIDE_CONTEXT);
        assertThat(context.summary()).contains("Diagnosis: same error");
        assertThat(context.options()).hasSize(2);
        assertThat(context.deadline()).isNull();
    }

    @Test
    void prepare_shouldRecommendARetryForTransientTrouble() {
        DefaultEscalationHandler handler = new DefaultEscalationHandler(clock, null, 4);
        SessionState transientFailure = stuck.toBuilder()
                .failures(List.of(new Failure(ErrorKind.TRANSIENT, "reset", "EXECUTE_TOOL", "add_edge",
                        Map.of(), 0, 1, NOW)))
                .build();

        assertThat(handler.prepare(transientFailure, "stuck").recommendedOption())
                .isEqualTo(DefaultEscalationHandler.RETRY);
    }
}
