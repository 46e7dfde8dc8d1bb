package com.eainde.graphagent.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GraphContextProviderTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.upsertNode(new NodeSpec("Person", "john_doe", Map.of("name", "John Doe")));
        store.upsertNode(new NodeSpec("Company", "acme", Map.of("name", "Acme Corp")));
        store.upsertNode(new NodeSpec("Person", "mary", Map.of("name", "Mary Major")));
        store.upsertEdge(new EdgeSpec("WORKS_AT", "Person", "john_doe", "Company", "acme", Map.of()));
    }

    @Test
    void snapshotFor_shouldSeedOnSharedTokensAndExpandNeighbours() {
        GraphContextProvider provider = new GraphContextProvider(store, 1, 10);

        GraphSnapshot snapshot = provider.snapshotFor(List.of("John"));

        assertThat(snapshot.nodes()).extracting(Node::key).containsExactly("john_doe", "acme");
        assertThat(snapshot.edges()).hasSize(1);
        assertThat(snapshot.nodes()).extracting(Node::key).doesNotContain("mary");
    }

    @Test
    void snapshotFor_shouldStopAtMaxNodes() {
        GraphContextProvider provider = new GraphContextProvider(store, 2, 1);

        GraphSnapshot snapshot = provider.snapshotFor(List.of("John"));

        assertThat(snapshot.nodes()).hasSize(1);
        assertThat(snapshot.edges()).isEmpty();
    }

    @Test
    void snapshotFor_shouldBeEmptyWithoutMatchesOrMentions() {
        GraphContextProvider provider = new GraphContextProvider(store, 1, 10);

        assertThat(provider.snapshotFor(List.of("Zed")).isEmpty()).isTrue();
        assertThat(provider.snapshotFor(List.of()).isEmpty()).isTrue();
    }
}
