package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.model.Remediation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FailurePatternDiagnoserTest {

    private final FailurePatternDiagnoser diagnoser = new FailurePatternDiagnoser();

    private static Failure failure(ErrorKind kind, String message, String tool, Map<String, Object> args, int attempt) {
        return new Failure(kind, message, "EXECUTE_TOOL", tool, args, 0, attempt,
                Instant.parse("2025-01-01T00:00:00Z").plusSeconds(attempt));
    }

    @Test
    void classify_shouldCallAnEmptyHistoryRandom() {
        assertThat(diagnoser.classify(List.of()).classification()).isEqualTo(FailureClassification.RANDOM);
        assertThat(diagnoser.classify(null).remediation()).isEqualTo(Remediation.RETRY);
    }

    @Test
    void classify_shouldDetectBackToBackIdenticalFailures() {
        Failure first = failure(ErrorKind.TRANSIENT, "Connection reset", "add_node", Map.of("key", "a"), 1);
        Failure second = failure(ErrorKind.TRANSIENT, "Connection reset", "add_node", Map.of("key", "a"), 2);

        Diagnosis diagnosis = diagnoser.classify(List.of(first, second));

        assertThat(diagnosis.classification()).isEqualTo(FailureClassification.IDENTICAL);
        assertThat(diagnosis.remediation()).isEqualTo(Remediation.ESCALATE_SOON);
        assertThat(diagnosis.reason()).contains("repeated 2 times");
    }

    @Test
    void classify_shouldCallBackToBackVaryingFailuresOfOneToolRandom() {
        Failure first = failure(ErrorKind.VALIDATION, "Missing property 'name'", "add_node", Map.of("key", "a"), 1);
        Failure second = failure(ErrorKind.VALIDATION, "Label must not be blank", "add_node", Map.of("key", "b"), 2);

        Diagnosis diagnosis = diagnoser.classify(List.of(first, second));

        assertThat(diagnosis.classification()).isEqualTo(FailureClassification.RANDOM);
        assertThat(diagnosis.remediation()).isEqualTo(Remediation.RETRY);
    }

    @Test
    void classify_shouldDetectSystematicFailuresAcrossNonConsecutiveAttempts() {
        Failure first = failure(ErrorKind.NOT_FOUND, "Source missing", "add_edge", Map.of("source_key", "a"), 1);
        Failure between = failure(ErrorKind.TIMEOUT, "Timed out", "query_graph", Map.of("query", "all_nodes"), 2);
        Failure third = failure(ErrorKind.NOT_FOUND, "Target missing", "add_edge", Map.of("source_key", "b"), 3);

        Diagnosis diagnosis = diagnoser.classify(List.of(first, between, third));

        assertThat(diagnosis.classification()).isEqualTo(FailureClassification.SYSTEMATIC);
        assertThat(diagnosis.remediation()).isEqualTo(Remediation.INCREASE_DISCLOSURE);
        assertThat(diagnosis.reason()).contains("add_edge");
    }

    @Test
    void classify_shouldDetectRecurringArgumentsWithDifferentErrors() {
        Map<String, Object> args = Map.of("label", "Person", "key", "ghost");
        Failure first = failure(ErrorKind.NOT_FOUND, "No such node", "delete_node", args, 1);
        Failure between = failure(ErrorKind.VALIDATION, "Bad label", "delete_node", Map.of("label", ""), 2);
        Failure third = failure(ErrorKind.CONSTRAINT_VIOLATION, "Node still has edges", "delete_node", args, 3);

        assertThat(diagnoser.classify(List.of(first, between, third)).classification())
                .isEqualTo(FailureClassification.SYSTEMATIC);
    }

    @Test
    void classify_shouldCallUnrelatedFailuresRandom() {
        Failure first = failure(ErrorKind.NOT_FOUND, "Source missing", "add_edge", Map.of(), 1);
        Failure second = failure(ErrorKind.TIMEOUT, "Timed out", "query_graph", Map.of("query", "all_nodes"), 2);

        assertThat(diagnoser.classify(List.of(first, second)).classification())
                .isEqualTo(FailureClassification.RANDOM);
    }
}
