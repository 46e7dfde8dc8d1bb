package com.eainde.graphagent.graph;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted graph node. {@code id} is assigned by the store; {@code (label, key)}
 * is the natural key used for idempotent upserts.
 */
public record Node(
        String id,
        String label,
        String key,
        Map<String, Object> properties,
        Instant createdAt,
        Instant updatedAt
) {
    public Node {
        properties = Props.copyOf(properties);
    }

    /** Display name: the {@code name} property when present, the natural key otherwise. */
    public String name() {
        Object name = properties.get("name");
        return name != null ? name.toString() : key;
    }

    public String naturalKey() {
        return label + ":" + key;
    }
}
