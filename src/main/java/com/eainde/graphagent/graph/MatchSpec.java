package com.eainde.graphagent.graph;

import java.util.Map;
import java.util.Objects;

/**
 * Criteria for selecting nodes or edges. Null fields match anything; for edges
 * {@code label} is compared against the relationship type.
 */
public record MatchSpec(String id, String label, String key, Map<String, Object> properties) {

    public MatchSpec {
        properties = Props.copyOf(properties);
    }

    public static MatchSpec byKey(String label, String key) {
        return new MatchSpec(null, label, key, Map.of());
    }

    public static MatchSpec byId(String id) {
        return new MatchSpec(id, null, null, Map.of());
    }

    public static MatchSpec byLabel(String label) {
        return new MatchSpec(null, label, null, Map.of());
    }

    public boolean isEmpty() {
        return id == null && label == null && key == null && properties.isEmpty();
    }

    public boolean matches(Node node) {
        if (id != null && !id.equals(node.id())) {
            return false;
        }
        if (label != null && !label.equals(node.label())) {
            return false;
        }
        if (key != null && !key.equals(node.key())) {
            return false;
        }
        return propertiesMatch(node.properties());
    }

    public boolean matches(Edge edge) {
        if (id != null && !id.equals(edge.id())) {
            return false;
        }
        if (label != null && !label.equals(edge.relationshipType())) {
            return false;
        }
        if (key != null && !key.equals(edge.sourceKey()) && !key.equals(edge.targetKey())) {
            return false;
        }
        return propertiesMatch(edge.properties());
    }

    private boolean propertiesMatch(Map<String, Object> candidate) {
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (!candidate.containsKey(entry.getKey())
                    || !Objects.equals(String.valueOf(candidate.get(entry.getKey())), String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }
}
