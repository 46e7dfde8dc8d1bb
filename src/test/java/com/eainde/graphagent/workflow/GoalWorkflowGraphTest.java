package com.eainde.graphagent.workflow;

import com.eainde.graphagent.checkpoint.InMemoryCheckpointSaver;
import com.eainde.graphagent.edges.SessionEdge;
import com.eainde.graphagent.graph.NodeSpec;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.nodes.SessionNode;
import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import com.eainde.graphagent.state.Suspension;
import com.eainde.graphagent.state.SuspensionKind;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoalWorkflowGraphTest {

    private static final String CREATE_EXAMPLE = "Create 'Example' of type 'demo'";

    private final WorkflowFixture fixture = new WorkflowFixture();

    private SessionState invoke(SessionState initial) throws Exception {
        CompiledGraph<GoalState> graph = fixture.workflow.define(TransitionGuard.NONE).compile();
        RunnableConfig config = RunnableConfig.builder().threadId(initial.sessionId()).build();
        return graph.invoke(GoalState.of(initial), config).orElseThrow().session();
    }

    private SessionState fresh(String goal) {
        return SessionState.start("s-1", goal, 3, 100, WorkflowFixture.START);
    }

    // =========================================================================
    //  Goal workflow
    // =========================================================================

    @Nested
    @DisplayName("Goal workflow")
    class GoalWorkflow {

        @Test
        void invoke_shouldRunASimpleGoalToTheEnd() throws Exception {
            // Act
            SessionState done = invoke(fresh(CREATE_EXAMPLE));

            // Assert
            assertThat(done.status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(done.currentNode()).isEqualTo(NodeName.END);
            assertThat(done.version()).isGreaterThan(fresh(CREATE_EXAMPLE).version());
            assertThat(fixture.store.findNode("demo", "Example")).isPresent();
        }

        @Test
        void invoke_shouldLeaveTheGraphWhenANodeAsksAQuestion() throws Exception {
            // Arrange
            fixture.store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));
            fixture.store.upsertNode(new NodeSpec("Person", "john_smith", Map.of("name", "John Smith")));

            // Act
            SessionState waiting = invoke(fresh("Delete John"));

            // Assert
            assertThat(waiting.status()).isEqualTo(SessionStatus.AWAITING_INPUT);
            assertThat(waiting.currentNode()).isEqualTo(NodeName.DISAMBIGUATE);
            assertThat(waiting.suspension().kind()).isEqualTo(SuspensionKind.DISAMBIGUATION);
        }

        @Test
        void orchestrator_shouldRefuseADefinitionThatDoesNotCompile() {
            WorkflowDefinition broken = guard -> {
                throw new GraphStateException("no entry point");
            };

            assertThatThrownBy(() -> new Orchestrator(broken, new InMemoryCheckpointSaver(), List.of(),
                    fixture.clock, 10, 3, 100))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no entry point");
        }
    }

    // =========================================================================
    //  Nodes and edges
    // =========================================================================

    @Nested
    @DisplayName("Nodes and edges")
    class NodesAndEdges {

        @Test
        void node_shouldApplyDeltaAndCountTheTransition() throws Exception {
            SessionNode node = state -> StateDelta.progress("parsed");
            SessionState initial = fresh(CREATE_EXAMPLE);

            // Act
            Map<String, Object> update = node.apply(new GoalState(GoalState.of(initial))).get();

            // Assert
            SessionState next = GoalState.decode(update);
            assertThat(next.version()).isEqualTo(initial.version() + 1);
            assertThat(next.progress()).containsExactly("parsed");
            assertThat(next.currentNode()).isEqualTo(initial.currentNode());
        }

        @Test
        void edge_shouldRouteRunningSessions() throws Exception {
            SessionEdge edge = state -> NodeName.RESOLVE_ENTITIES;

            String next = edge.apply(new GoalState(GoalState.of(fresh(CREATE_EXAMPLE)))).get();

            assertThat(next).isEqualTo("RESOLVE_ENTITIES");
        }

        @Test
        void edge_shouldSendSuspendedSessionsToEndWithoutRouting() throws Exception {
            SessionEdge edge = state -> {
                throw new AssertionError("edge must not route a suspended session");
            };
            SessionState suspended = suspendedAt(NodeName.ESCALATE);

            String next = edge.apply(new GoalState(GoalState.of(suspended))).get();

            assertThat(next).isEqualTo("END");
        }
    }

    // =========================================================================
    //  GoalState
    // =========================================================================

    @Nested
    @DisplayName("GoalState")
    class GoalStateTests {

        @Test
        void positioned_shouldMoveToTheNextGraphNode() {
            SessionState state = fresh(CREATE_EXAMPLE);

            assertThat(GoalState.positioned(state, "ANSWER").currentNode()).isEqualTo(NodeName.ANSWER);
            assertThat(GoalState.positioned(state, null)).isSameAs(state);
        }

        @Test
        void positioned_shouldKeepSuspendedSessionsOnTheAskingNode() {
            SessionState suspended = suspendedAt(NodeName.DISAMBIGUATE);

            assertThat(GoalState.positioned(suspended, "END").currentNode()).isEqualTo(NodeName.DISAMBIGUATE);
        }

        @Test
        void advance_shouldRestTerminalSessionsOnEnd() {
            SessionState state = fresh(CREATE_EXAMPLE);

            SessionState done = GoalState.advance(state,
                    StateDelta.builder().status(SessionStatus.COMPLETED).build(), WorkflowFixture.START);

            assertThat(done.currentNode()).isEqualTo(NodeName.END);
            assertThat(done.version()).isEqualTo(state.version() + 1);
        }

        @Test
        void session_shouldFailWithoutSessionData() {
            assertThatThrownBy(() -> new GoalState(Map.of()).session())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    private SessionState suspendedAt(NodeName node) {
        Suspension suspension = new Suspension(SuspensionKind.ESCALATION, node, "Which one?",
                List.of("a", "b"), List.of(), null, WorkflowFixture.START);
        return fresh(CREATE_EXAMPLE).toBuilder()
                .status(SessionStatus.AWAITING_INPUT)
                .suspension(suspension)
                .build();
    }
}
