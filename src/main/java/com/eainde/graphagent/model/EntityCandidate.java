package com.eainde.graphagent.model;

import com.eainde.graphagent.graph.Node;
import com.eainde.graphagent.graph.Props;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A graph entity considered as the referent of a mention.
 *
 * @param similarity overall confidence in [0, 1] once scored
 * @param mergedFrom ids of near-duplicates folded into this candidate, sorted
 */
public record EntityCandidate(
        String id,
        String name,
        String label,
        String key,
        Map<String, Object> properties,
        double similarity,
        String source,
        Instant updatedAt,
        List<String> mergedFrom
) {
    public static final String DEFAULT_SOURCE = "graph";

    public EntityCandidate {
        properties = Props.copyOf(properties);
        mergedFrom = mergedFrom == null ? List.of() : List.copyOf(mergedFrom);
        source = source == null ? DEFAULT_SOURCE : source;
    }

    public static EntityCandidate fromNode(Node node) {
        Object source = node.properties().get("source");
        return new EntityCandidate(node.id(), node.name(), node.label(), node.key(), node.properties(), 0.0,
                source != null ? source.toString() : DEFAULT_SOURCE, node.updatedAt(), List.of());
    }

    public EntityCandidate withSimilarity(double value) {
        return new EntityCandidate(id, name, label, key, properties, value, source, updatedAt, mergedFrom);
    }
}
