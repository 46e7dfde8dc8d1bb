package com.eainde.graphagent.graph;

import java.util.Map;

/**
 * Input for {@link GraphStore#upsertEdge(EdgeSpec)}. Endpoints are addressed by natural key.
 */
public record EdgeSpec(
        String relationshipType,
        String sourceLabel,
        String sourceKey,
        String targetLabel,
        String targetKey,
        Map<String, Object> properties
) {
    public EdgeSpec {
        properties = Props.copyOf(properties);
    }
}
