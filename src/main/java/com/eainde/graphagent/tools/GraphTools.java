package com.eainde.graphagent.tools;

import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.graph.Edge;
import com.eainde.graphagent.graph.EdgeSpec;
import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.graph.GraphStore;
import com.eainde.graphagent.graph.MatchSpec;
import com.eainde.graphagent.graph.Node;
import com.eainde.graphagent.graph.NodeSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The graph mutation and query tools. All addressing is by natural key
 * ({@code label} + {@code key}); store-assigned ids never enter a signature.
 */
public final class GraphTools {

    public static final String ADD_NODE = "add_node";
    public static final String ADD_EDGE = "add_edge";
    public static final String UPDATE_PROPS = "update_props";
    public static final String DELETE_NODE = "delete_node";
    public static final String DELETE_EDGE = "delete_edge";
    public static final String QUERY_GRAPH = "query_graph";
    public static final String GET_SUBGRAPH = "get_subgraph";

    private GraphTools() {
    }

    public static List<Tool> all(GraphStore store, int maxDepth) {
        return List.of(
                addNode(store),
                addEdge(store),
                updateProps(store),
                deleteNode(store),
                deleteEdge(store),
                queryGraph(store),
                getSubgraph(store, maxDepth));
    }

    static Tool addNode(GraphStore store) {
        return new GraphTool(ADD_NODE,
                "Create a node, or merge properties into the node with the same label and key.",
                ToolSchema.builder()
                        .required("label", ArgumentType.STRING)
                        .required("key", ArgumentType.STRING)
                        .optional("properties", ArgumentType.OBJECT)
                        .build(),
                args -> {
                    String label = (String) args.get("label");
                    String key = (String) args.get("key");
                    boolean existed = store.findNode(label, key).isPresent();
                    Node node = store.upsertNode(new NodeSpec(label, key, properties(args)));
                    Map<String, Object> payload = nodeRow(node);
                    payload.put("created", !existed);
                    return payload;
                });
    }

    static Tool addEdge(GraphStore store) {
        return new GraphTool(ADD_EDGE,
                "Create a relationship between two existing nodes, or merge its properties if it exists.",
                ToolSchema.builder()
                        .required("type", ArgumentType.STRING)
                        .required("source_label", ArgumentType.STRING)
                        .required("source_key", ArgumentType.STRING)
                        .required("target_label", ArgumentType.STRING)
                        .required("target_key", ArgumentType.STRING)
                        .optional("properties", ArgumentType.OBJECT)
                        .build(),
                args -> {
                    Edge edge = store.upsertEdge(new EdgeSpec((String) args.get("type"),
                            (String) args.get("source_label"), (String) args.get("source_key"),
                            (String) args.get("target_label"), (String) args.get("target_key"),
                            properties(args)));
                    return edgeRow(edge);
                });
    }

    static Tool updateProps(GraphStore store) {
        return new GraphTool(UPDATE_PROPS,
                "Merge properties into the node identified by label and key.",
                ToolSchema.builder()
                        .required("label", ArgumentType.STRING)
                        .required("key", ArgumentType.STRING)
                        .required("properties", ArgumentType.OBJECT)
                        .build(),
                args -> {
                    int updated = store.updateProps(match(args), properties(args));
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("label", args.get("label"));
                    payload.put("key", args.get("key"));
                    payload.put("updated", updated);
                    return payload;
                });
    }

    static Tool deleteNode(GraphStore store) {
        return new GraphTool(DELETE_NODE,
                "Delete the node identified by label and key together with its relationships.",
                ToolSchema.builder()
                        .required("label", ArgumentType.STRING)
                        .required("key", ArgumentType.STRING)
                        .build(),
                args -> {
                    int deleted = store.deleteNode(match(args));
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("label", args.get("label"));
                    payload.put("key", args.get("key"));
                    payload.put("deleted", deleted);
                    return payload;
                });
    }

    static Tool deleteEdge(GraphStore store) {
        return new GraphTool(DELETE_EDGE,
                "Delete relationships of a type, optionally only those touching the node with the given key.",
                ToolSchema.builder()
                        .required("type", ArgumentType.STRING)
                        .optional("key", ArgumentType.STRING)
                        .optional("properties", ArgumentType.OBJECT)
                        .build(),
                args -> {
                    int deleted = store.deleteEdge(new MatchSpec(null, (String) args.get("type"),
                            (String) args.get("key"), properties(args)));
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("type", args.get("type"));
                    payload.put("deleted", deleted);
                    return payload;
                });
    }

    static Tool queryGraph(GraphStore store) {
        return new GraphTool(QUERY_GRAPH,
                "Run a named read-only query: all_nodes, nodes_by_label, node_by_key, neighbors or count_nodes.",
                ToolSchema.builder()
                        .required("query", ArgumentType.STRING)
                        .optional("params", ArgumentType.OBJECT)
                        .build(),
                args -> {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> params = (Map<String, Object>) args.getOrDefault("params", Map.of());
                    List<Map<String, Object>> rows = store.runQuery((String) args.get("query"), params);
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("query", args.get("query"));
                    payload.put("rows", rows);
                    payload.put("count", rows.size());
                    return payload;
                });
    }

    static Tool getSubgraph(GraphStore store, int maxDepth) {
        return new GraphTool(GET_SUBGRAPH,
                "Return the node identified by label and key with its neighbourhood up to the given depth.",
                ToolSchema.builder()
                        .required("label", ArgumentType.STRING)
                        .required("key", ArgumentType.STRING)
                        .optional("depth", ArgumentType.INTEGER)
                        .build(),
                args -> {
                    int depth = args.get("depth") == null ? 1 : Integer.parseInt(args.get("depth").toString());
                    if (depth < 0 || depth > maxDepth) {
                        throw new ValidationException("depth must be between 0 and " + maxDepth);
                    }
                    GraphSnapshot snapshot = store.getSubgraph(match(args), depth);
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("nodes", snapshot.nodes().stream().map(GraphTools::nodeRow).toList());
                    payload.put("edges", snapshot.edges().stream().map(GraphTools::edgeRow).toList());
                    payload.put("depth", depth);
                    return payload;
                });
    }

    private static MatchSpec match(Map<String, Object> args) {
        return MatchSpec.byKey((String) args.get("label"), (String) args.get("key"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> properties(Map<String, Object> args) {
        Object properties = args.get("properties");
        return properties == null ? Map.of() : (Map<String, Object>) properties;
    }

    private static Map<String, Object> nodeRow(Node node) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("node_id", node.id());
        row.put("label", node.label());
        row.put("key", node.key());
        row.put("properties", node.properties());
        return row;
    }

    private static Map<String, Object> edgeRow(Edge edge) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("edge_id", edge.id());
        row.put("type", edge.relationshipType());
        row.put("source", edge.sourceLabel() + ":" + edge.sourceKey());
        row.put("target", edge.targetLabel() + ":" + edge.targetKey());
        row.put("properties", edge.properties());
        return row;
    }

    private record GraphTool(String name, String description, ToolSchema schema,
                             Function<Map<String, Object>, Map<String, Object>> action) implements Tool {

        @Override
        public Map<String, Object> execute(Map<String, Object> arguments) {
            return action.apply(arguments);
        }
    }
}
