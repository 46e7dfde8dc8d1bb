package com.eainde.graphagent.tools;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.error.QueryException;
import com.eainde.graphagent.error.TransientGraphException;
import com.eainde.graphagent.graph.InMemoryGraphStore;
import com.eainde.graphagent.graph.NodeSpec;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.ExecutionStatus;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private InMemoryGraphStore store;
    private MdcAwareExecutor workers;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(Map.of("Person", Set.of("email")), Clock.systemUTC());
        List<Tool> tools = new ArrayList<>(GraphTools.all(store, 3));
        tools.add(tool("flaky", args -> {
            throw new TransientGraphException("Connection reset by graph store");
        }));
        tools.add(tool("broken", args -> {
            throw new QueryException("Syntax error near MATCH");
        }));
        tools.add(tool("slow", args -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of();
        }));
        workers = new MdcAwareExecutor(2, "tool-test");
        executor = new ToolExecutor(new ToolRegistry(tools), workers, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        workers.close();
    }

    private static Tool tool(String name, Function<Map<String, Object>, Map<String, Object>> action) {
        return new Tool() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return "Test tool " + name;
            }

            @Override
            public ToolSchema schema() {
                return ToolSchema.builder().build();
            }

            @Override
            public Map<String, Object> execute(Map<String, Object> arguments) {
                return action.apply(arguments);
            }
        };
    }

    // =========================================================================
    //  Successful calls
    // =========================================================================

    @Nested
    @DisplayName("graph tools")
    class GraphToolCalls {

        @Test
        @DisplayName("add_node reports whether the node was created or merged")
        void addNodeIsIdempotent() {
            ToolSignature signature = ToolSignature.of(GraphTools.ADD_NODE,
                    Map.of("label", "Person", "key", "alice", "properties", Map.of("name", "Alice")));

            ExecutionResult first = executor.execute(signature);
            ExecutionResult second = executor.execute(signature);

            assertThat(first.isSuccess()).isTrue();
            assertThat(first.payload()).containsEntry("created", true);
            assertThat(second.payload()).containsEntry("created", false)
                    .containsEntry("node_id", first.payload().get("node_id"));
            assertThat(store.allNodes()).hasSize(1);
        }

        @Test
        @DisplayName("query_graph returns rows and a count")
        void queryGraph() {
            store.upsertNode(NodeSpec.of("Person", "alice"));

            ExecutionResult result = executor.execute(ToolSignature.of(GraphTools.QUERY_GRAPH,
                    Map.of("query", "nodes_by_label", "params", Map.of("label", "Person"))));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.payload()).containsEntry("count", 1);
        }

        @Test
        @DisplayName("get_subgraph accepts a numeric string depth")
        void subgraphDepthAsString() {
            store.upsertNode(NodeSpec.of("Person", "alice"));

            ExecutionResult result = executor.execute(ToolSignature.of(GraphTools.GET_SUBGRAPH,
                    Map.of("label", "Person", "key", "alice", "depth", "2")));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.payload()).containsEntry("depth", 2);
        }
    }

    // =========================================================================
    //  Failures become results
    // =========================================================================

    @Nested
    @DisplayName("error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("unknown tool is a retryable validation error")
        void unknownTool() {
            ExecutionResult result = executor.execute(ToolSignature.of("drop_database", Map.of()));

            assertThat(result.status()).isEqualTo(ExecutionStatus.VALIDATION_ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.TOOL_NOT_FOUND);
            assertThat(result.retryable()).isTrue();
            assertThat(result.error()).contains("drop_database");
        }

        @Test
        @DisplayName("schema violations list every problem")
        void schemaViolation() {
            ExecutionResult result = executor.execute(ToolSignature.of(GraphTools.ADD_NODE,
                    Map.of("label", "Person", "node_id", "123")));

            assertThat(result.status()).isEqualTo(ExecutionStatus.VALIDATION_ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.error())
                    .contains("missing required argument 'key'")
                    .contains("unknown argument 'node_id'");
        }

        @Test
        @DisplayName("constraint violations are rewritten into a readable message")
        void constraintViolation() {
            store.upsertNode(new NodeSpec("Person", "alice", Map.of("email", "a@example.com")));

            ExecutionResult result = executor.execute(ToolSignature.of(GraphTools.ADD_NODE,
                    Map.of("label", "Person", "key", "alicia", "properties", Map.of("email", "a@example.com"))));

            assertThat(result.status()).isEqualTo(ExecutionStatus.VALIDATION_ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
            assertThat(result.error()).startsWith("The change conflicts with an existing entity");
        }

        @Test
        @DisplayName("a missing entity is a retryable not-found error")
        void notFound() {
            ExecutionResult result = executor.execute(ToolSignature.of(GraphTools.DELETE_NODE,
                    Map.of("label", "Person", "key", "ghost")));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(result.retryable()).isTrue();
        }

        @Test
        @DisplayName("transient store failures are retryable execution errors")
        void transientFailure() {
            ExecutionResult result = executor.execute(ToolSignature.of("flaky", Map.of()));

            assertThat(result.status()).isEqualTo(ExecutionStatus.EXECUTION_ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.TRANSIENT);
            assertThat(result.retryable()).isTrue();
        }

        @Test
        @DisplayName("query failures are not retryable")
        void queryFailure() {
            ExecutionResult result = executor.execute(ToolSignature.of("broken", Map.of()));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.QUERY);
            assertThat(result.retryable()).isFalse();
        }

        @Test
        @DisplayName("a call over the timeout is a retryable timeout")
        void timeout() {
            ExecutionResult result = executor.execute(ToolSignature.of("slow", Map.of()));

            assertThat(result.status()).isEqualTo(ExecutionStatus.EXECUTION_ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(result.retryable()).isTrue();
        }
    }
}
