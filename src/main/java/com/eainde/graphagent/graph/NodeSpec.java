package com.eainde.graphagent.graph;

import java.util.Map;

/**
 * Input for {@link GraphStore#upsertNode(NodeSpec)}.
 */
public record NodeSpec(String label, String key, Map<String, Object> properties) {

    public NodeSpec {
        properties = Props.copyOf(properties);
    }

    public static NodeSpec of(String label, String key) {
        return new NodeSpec(label, key, Map.of());
    }
}
