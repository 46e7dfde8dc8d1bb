package com.eainde.graphagent.resolution;

import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.graph.InMemoryGraphStore;
import com.eainde.graphagent.graph.Node;
import com.eainde.graphagent.graph.NodeSpec;
import com.eainde.graphagent.model.ConfidenceWeights;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityMention;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.GoalComplexity;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.model.ResolutionStrategy;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GraphAwareEntityResolverTest {

    private InMemoryGraphStore store;
    private GraphAwareEntityResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        resolver = new GraphAwareEntityResolver(
                new SimilarityScorer(ConfidenceWeights.defaults()),
                new DefaultResolutionRules(),
                new DeduplicationEngine(),
                ResolutionSettings.defaults(),
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private GraphSnapshot snapshot() {
        return new GraphSnapshot(store.allNodes(), store.allEdges(), "test", 1, List.of());
    }

    // =========================================================================
    //  resolve
    // =========================================================================

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("should use the existing entity with full confidence on an exact key match")
        void exactKey() {
            Node alice = store.upsertNode(new NodeSpec("Person", "alice", Map.of("name", "Alice")));

            EntityResolution resolution = resolver.resolve(EntityMention.of("alice"), snapshot());

            assertThat(resolution.strategy()).isEqualTo(ResolutionStrategy.USE_EXISTING);
            assertThat(resolution.entityId()).isEqualTo(alice.id());
            assertThat(resolution.confidence().overall()).isEqualTo(1.0);
            assertThat(resolution.reasoning()).contains("natural key");
        }

        @Test
        @DisplayName("should create a new entity when the context is empty")
        void emptyContext() {
            EntityResolution resolution = resolver.resolve(EntityMention.of("Alice"), GraphSnapshot.empty("none"));

            assertThat(resolution.strategy()).isEqualTo(ResolutionStrategy.CREATE_NEW);
            assertThat(resolution.candidates()).isEmpty();
        }

        @Test
        @DisplayName("should reject a blank mention")
        void blankMention() {
            assertThatThrownBy(() -> resolver.resolve(EntityMention.of("  "), snapshot()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should ask the user when two distinct entities tie")
        void ambiguousFirstName() {
            store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));
            store.upsertNode(new NodeSpec("Person", "john_smith", Map.of("name", "John Smith")));

            EntityResolution resolution = resolver.resolve(EntityMention.of("John"), snapshot());

            assertThat(resolution.strategy()).isEqualTo(ResolutionStrategy.ASK_USER);
            assertThat(resolution.isAmbiguous()).isTrue();
            assertThat(resolution.candidates()).extracting(EntityCandidate::key)
                    .containsExactlyInAnyOrder("john_doe", "john_smith");
            assertThat(resolution.candidates()).allSatisfy(c -> assertThat(c.similarity()).isCloseTo(0.71, within(1e-9)));
            assertThat(resolution.entityId()).isNull();
        }

        @Test
        @DisplayName("should accept a lone plausible candidate")
        void singleCandidate() {
            Node doe = store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));

            EntityResolution resolution = resolver.resolve(EntityMention.of("John"), snapshot());

            assertThat(resolution.strategy()).isEqualTo(ResolutionStrategy.USE_EXISTING);
            assertThat(resolution.entityId()).isEqualTo(doe.id());
            assertThat(resolution.reasoning()).startsWith("Single plausible candidate");
        }

        @Test
        @DisplayName("should fold tied near-duplicates into one candidate")
        void mergesDuplicates() {
            Node first = store.upsertNode(new NodeSpec("Company", "acme_corp", Map.of("name", "Acme Corp")));
            Node second = store.upsertNode(new NodeSpec("Company", "acme_corp_2", Map.of("name", "ACME Corp.")));

            EntityResolution resolution = resolver.resolve(EntityMention.of("Acme"), snapshot());

            assertThat(resolution.strategy()).isEqualTo(ResolutionStrategy.USE_EXISTING);
            assertThat(resolution.entityId()).isEqualTo(first.id());
            assertThat(resolution.candidates()).singleElement()
                    .satisfies(c -> assertThat(c.mergedFrom()).containsExactly(second.id()));
        }
    }

    // =========================================================================
    //  Human choices
    // =========================================================================

    @Nested
    @DisplayName("choose / createNew")
    class Choices {

        private EntityResolution ambiguous;
        private Node smith;

        @BeforeEach
        void seed() {
            store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));
            smith = store.upsertNode(new NodeSpec("Person", "john_smith", Map.of("name", "John Smith")));
            ambiguous = resolver.resolve(EntityMention.of("John"), snapshot());
        }

        @Test
        @DisplayName("choose binds to the offered candidate and supersedes the old decision")
        void choose() {
            EntityResolution chosen = resolver.choose(ambiguous, smith.id());

            assertThat(chosen.strategy()).isEqualTo(ResolutionStrategy.USE_EXISTING);
            assertThat(chosen.entityKey()).isEqualTo("john_smith");
            assertThat(chosen.supersedes()).isEqualTo(ambiguous.resolutionId());
            assertThat(chosen.resolutionId()).isNotEqualTo(ambiguous.resolutionId());
        }

        @Test
        @DisplayName("choose rejects a candidate that was not offered")
        void chooseUnknown() {
            assertThatThrownBy(() -> resolver.choose(ambiguous, "nope"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("createNew turns the mention into a new entity")
        void createNew() {
            EntityResolution created = resolver.createNew(ambiguous);

            assertThat(created.strategy()).isEqualTo(ResolutionStrategy.CREATE_NEW);
            assertThat(created.mention()).isEqualTo("John");
            assertThat(created.supersedes()).isEqualTo(ambiguous.resolutionId());
        }
    }

    @Test
    void resolveAll_shouldCollectPendingAmbiguities() {
        store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));
        store.upsertNode(new NodeSpec("Person", "john_smith", Map.of("name", "John Smith")));
        IntentSpec intent = new IntentSpec("Delete John", IntentType.DELETE, List.of("John"),
                GoalComplexity.SIMPLE, true, Map.of());

        ResolvedGoalSpec resolved = resolver.resolveAll(intent, snapshot());

        assertThat(resolved.readyToExecute()).isFalse();
        assertThat(resolved.pendingAmbiguities()).singleElement()
                .satisfies(a -> assertThat(a.question()).startsWith("Which entity did you mean by 'John'?"));

        EntityResolution chosen = resolver.choose(resolved.resolutions().get(0),
                store.findNode("Person", "john_doe").orElseThrow().id());
        ResolvedGoalSpec ready = resolved.withResolution(chosen);

        assertThat(ready.readyToExecute()).isTrue();
        assertThat(ready.requireBindings()).containsExactly(chosen);
    }
}
