package com.eainde.graphagent.graph;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted relationship between two nodes, keyed by
 * {@code (source, relationshipType, target)}.
 */
public record Edge(
        String id,
        String relationshipType,
        String sourceId,
        String targetId,
        String sourceLabel,
        String sourceKey,
        String targetLabel,
        String targetKey,
        Map<String, Object> properties,
        Instant createdAt,
        Instant updatedAt
) {
    public Edge {
        properties = Props.copyOf(properties);
    }

    public String naturalKey() {
        return sourceLabel + ":" + sourceKey + "-[" + relationshipType + "]->" + targetLabel + ":" + targetKey;
    }
}
