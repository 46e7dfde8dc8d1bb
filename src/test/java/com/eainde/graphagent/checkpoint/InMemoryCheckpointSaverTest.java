package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.error.CheckpointException;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionStateFixtures;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCheckpointSaverTest {

    private final InMemoryCheckpointSaver saver = new InMemoryCheckpointSaver();

    @Test
    void save_shouldRoundTripEveryNestedType() {
        SessionState state = SessionStateFixtures.suspendedSession("s-1");

        saver.save(state);

        assertThat(saver.load("s-1")).contains(state);
        assertThat(saver.load("s-1").orElseThrow().isSuspended()).isTrue();
    }

    @Test
    void save_shouldKeepOnlyTheLatestState() {
        SessionState state = SessionStateFixtures.suspendedSession("s-1");
        saver.save(state);
        saver.save(state.toBuilder().version(8).build());

        assertThat(saver.load("s-1")).get().extracting(SessionState::version).isEqualTo(8L);
        assertThat(saver.sessionIds()).containsExactly("s-1");
    }

    @Test
    void delete_shouldReportWhetherAnythingWasRemoved() {
        saver.save(SessionStateFixtures.suspendedSession("s-1"));

        assertThat(saver.delete("s-1")).isTrue();
        assertThat(saver.delete("s-1")).isFalse();
        assertThat(saver.load("s-1")).isEmpty();
    }

    @Test
    void mapper_shouldWrapUnreadableCheckpoints() {
        assertThatThrownBy(() -> new CheckpointMapper().read("s-9", "{not json"))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("s-9");
    }
    // =========================================================================
    //  Graph checkpoints
    // =========================================================================

    @Nested
    @DisplayName("Graph checkpoints")
    class GraphCheckpoints {

        private final RunnableConfig thread = RunnableConfig.builder().threadId("s-1").build();
        private final SessionState running = SessionState.start("s-1", "Create 'Example'", 3, 100,
                Instant.parse("2025-01-01T10:00:00Z"));

        private Checkpoint checkpoint(SessionState state, String nodeId, String nextNodeId) {
            return Checkpoint.builder()
                    .id("cp-1")
                    .state(GoalState.of(state))
                    .nodeId(nodeId)
                    .nextNodeId(nextNodeId)
                    .build();
        }

        @Test
        void put_shouldPositionTheSessionOnTheNextNode() {
            // Act
            RunnableConfig written = saver.put(thread, checkpoint(running, "PARSE_INTENT", "RESOLVE_ENTITIES"));

            // Assert
            assertThat(written.threadId()).contains("s-1");
            assertThat(written.checkPointId()).contains("cp-1");
            assertThat(saver.load("s-1")).get()
                    .extracting(SessionState::currentNode).isEqualTo(NodeName.RESOLVE_ENTITIES);
        }

        @Test
        void get_shouldReturnTheLatestGraphCheckpoint() {
            saver.put(thread, checkpoint(running, "PARSE_INTENT", "RESOLVE_ENTITIES"));

            Checkpoint loaded = saver.get(thread).orElseThrow();

            assertThat(loaded.getId()).isEqualTo("cp-1");
            assertThat(loaded.getNodeId()).isEqualTo("PARSE_INTENT");
            assertThat(loaded.getNextNodeId()).isEqualTo("RESOLVE_ENTITIES");
            assertThat(GoalState.decode(loaded.getState()).sessionId()).isEqualTo("s-1");
            assertThat(saver.list(thread)).hasSize(1);
        }

        @Test
        void put_shouldKeepSuspendedSessionsOnTheAskingNode() {
            SessionState suspended = SessionStateFixtures.suspendedSession("s-1");

            saver.put(thread, checkpoint(suspended, "DISAMBIGUATE", "__END__"));

            assertThat(saver.load("s-1")).get()
                    .extracting(SessionState::currentNode).isEqualTo(suspended.suspension().node());
        }

        @Test
        void put_shouldRejectACheckpointOfAnotherSession() {
            RunnableConfig otherThread = RunnableConfig.builder().threadId("s-2").build();

            assertThatThrownBy(() -> saver.put(otherThread, checkpoint(running, "PARSE_INTENT", "RESOLVE_ENTITIES")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("s-2");
            assertThat(saver.sessionIds()).isEmpty();
        }

        @Test
        void release_shouldDropTheThread() {
            saver.put(thread, checkpoint(running, "PARSE_INTENT", "RESOLVE_ENTITIES"));

            BaseCheckpointSaver.Tag tag = saver.release(thread);

            assertThat(tag.threadId()).isEqualTo("s-1");
            assertThat(tag.checkpoints()).hasSize(1);
            assertThat(saver.get(thread)).isEmpty();
        }
    }
}
