package com.eainde.graphagent.state;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityConfidence;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.GoalComplexity;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.model.ResolutionStrategy;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.model.ToolSignature;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A suspended session with every nested type populated.
 */
public final class SessionStateFixtures {

    public static final Instant NOW = Instant.parse("2025-01-01T10:15:30Z");

    private SessionStateFixtures() {
    }

    public static SessionState suspendedSession(String sessionId) {
        EntityCandidate doe = new EntityCandidate("n1", "John Doe", "Person", "john_doe",
                Map.of("name", "John Doe"), 0.71, "graph", NOW, List.of());
        EntityCandidate smith = new EntityCandidate("n2", "John Smith", "Person", "john_smith",
                Map.of("name", "John Smith", "age", 42), 0.71, "graph", NOW, List.of("n3"));
        EntityResolution ambiguous = new EntityResolution("r1", "John", ResolutionStrategy.ASK_USER, null, null, null,
                new EntityConfidence(0.8, 0.8, 0.5, 0.5, 0.71), List.of(doe, smith), "2 plausible candidates",
                null, NOW);
        IntentSpec intent = new IntentSpec("Delete John", IntentType.DELETE, List.of("John"), GoalComplexity.SIMPLE,
                true, Map.of(IntentSpec.TYPE, "Person"));

        return SessionState.start(sessionId, "Delete John", 3, 50, NOW).toBuilder()
                .currentNode(NodeName.DISAMBIGUATE)
                .status(SessionStatus.AWAITING_INPUT)
                .intent(intent)
                .resolvedGoal(ResolvedGoalSpec.of(intent, List.of(ambiguous)))
                .resolutions(List.of(ambiguous))
                .currentSignature(ToolSignature.of("delete_node", Map.of("label", "Person", "key", "john_doe")))
                .lastResult(ExecutionResult.executionError("delete_node", ErrorKind.TRANSIENT, "reset", true))
                .suspension(new Suspension(SuspensionKind.DISAMBIGUATION, NodeName.DISAMBIGUATE,
                        "Which John?", List.of("n1: John Doe", "n2: John Smith"), List.of(doe, smith),
                        NOW.plusSeconds(3600), NOW))
                .humanResponse(HumanResponse.selectCandidate("John", "n1"))
                .progress(List.of("Parsed DELETE", "1 ambiguous mention"))
                .failures(List.of(new Failure(ErrorKind.TRANSIENT, "reset", "EXECUTE_TOOL", "delete_node",
                        Map.of("label", "Person", "depth", 1), 0, 1, NOW)))
                .artifacts(List.of(new Artifact("node_created", "n9", "Person:jane", 0, NOW)))
                .providedContext(List.of("John is the one in sales"))
                .retryCount(1)
                .version(7)
                .build();
    }
}
