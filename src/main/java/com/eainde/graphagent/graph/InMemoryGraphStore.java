package com.eainde.graphagent.graph;

import com.eainde.graphagent.error.ConstraintViolationException;
import com.eainde.graphagent.error.NotFoundException;
import com.eainde.graphagent.error.QueryException;
import com.eainde.graphagent.error.ValidationException;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Thread-safe in-memory {@link GraphStore}.
 * <p>
 * Nodes are indexed by {@code label:key}, edges by
 * {@code source-[type]->target}, which gives MERGE semantics: a second upsert of
 * the same natural key returns the existing element with merged properties.
 * Labels may declare unique properties; a value already owned by a different
 * node of that label raises {@link ConstraintViolationException}.
 * </p>
 *
 * <h3>Named queries</h3>
 * <ul>
 * <li>{@code all_nodes}</li>
 * <li>{@code nodes_by_label} (param {@code label})</li>
 * <li>{@code node_by_key} (params {@code label}, {@code key})</li>
 * <li>{@code neighbors} (params {@code label}, {@code key})</li>
 * <li>{@code count_nodes} (optional param {@code label})</li>
 * </ul>
 */
@Log4j2
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, Node> nodesById = new LinkedHashMap<>();
    private final Map<String, String> nodeIdsByKey = new HashMap<>();
    private final Map<String, Edge> edgesById = new LinkedHashMap<>();
    private final Map<String, String> edgeIdsByKey = new HashMap<>();
    private final Map<String, Set<String>> uniquePropertiesByLabel;
    private final Clock clock;

    public InMemoryGraphStore() {
        this(Map.of(), Clock.systemUTC());
    }

    public InMemoryGraphStore(Map<String, Set<String>> uniquePropertiesByLabel, Clock clock) {
        this.uniquePropertiesByLabel = Map.copyOf(uniquePropertiesByLabel);
        this.clock = clock;
    }

    @Override
    public synchronized Node upsertNode(NodeSpec spec) {
        if (spec == null || isBlank(spec.label()) || isBlank(spec.key())) {
            throw new ValidationException("Node label and key are required");
        }
        String naturalKey = spec.label() + ":" + spec.key();
        checkUniqueProperties(spec, naturalKey);

        Instant now = clock.instant();
        String existingId = nodeIdsByKey.get(naturalKey);
        if (existingId != null) {
            Node existing = nodesById.get(existingId);
            Node updated = new Node(existing.id(), existing.label(), existing.key(),
                    Props.merge(existing.properties(), spec.properties()), existing.createdAt(), now);
            nodesById.put(existingId, updated);
            log.debug("Merged node {} ({})", naturalKey, existingId);
            return updated;
        }

        Node created = new Node(UUID.randomUUID().toString(), spec.label(), spec.key(), spec.properties(), now, now);
        nodesById.put(created.id(), created);
        nodeIdsByKey.put(naturalKey, created.id());
        log.debug("Created node {} ({})", naturalKey, created.id());
        return created;
    }

    @Override
    public synchronized Edge upsertEdge(EdgeSpec spec) {
        if (spec == null || isBlank(spec.relationshipType()) || isBlank(spec.sourceKey()) || isBlank(spec.targetKey())) {
            throw new ValidationException("Edge relationship type, source key and target key are required");
        }
        String sourceKey = spec.sourceLabel() + ":" + spec.sourceKey();
        String targetKey = spec.targetLabel() + ":" + spec.targetKey();
        String sourceId = nodeIdsByKey.get(sourceKey);
        String targetId = nodeIdsByKey.get(targetKey);
        if (sourceId == null) {
            throw new NotFoundException("Source node not found: " + sourceKey);
        }
        if (targetId == null) {
            throw new NotFoundException("Target node not found: " + targetKey);
        }

        Instant now = clock.instant();
        String edgeKey = sourceKey + "-[" + spec.relationshipType() + "]->" + targetKey;
        String existingId = edgeIdsByKey.get(edgeKey);
        if (existingId != null) {
            Edge existing = edgesById.get(existingId);
            Edge updated = new Edge(existing.id(), existing.relationshipType(), existing.sourceId(), existing.targetId(),
                    existing.sourceLabel(), existing.sourceKey(), existing.targetLabel(), existing.targetKey(),
                    Props.merge(existing.properties(), spec.properties()), existing.createdAt(), now);
            edgesById.put(existingId, updated);
            return updated;
        }

        Edge created = new Edge(UUID.randomUUID().toString(), spec.relationshipType(), sourceId, targetId,
                spec.sourceLabel(), spec.sourceKey(), spec.targetLabel(), spec.targetKey(),
                spec.properties(), now, now);
        edgesById.put(created.id(), created);
        edgeIdsByKey.put(edgeKey, created.id());
        log.debug("Created edge {} ({})", edgeKey, created.id());
        return created;
    }

    @Override
    public synchronized int updateProps(MatchSpec match, Map<String, Object> props) {
        requireSelective(match);
        if (props == null || props.isEmpty()) {
            throw new ValidationException("No properties to update");
        }
        Instant now = clock.instant();
        int updated = 0;
        for (Node node : new ArrayList<>(nodesById.values())) {
            if (match.matches(node)) {
                checkUniqueProperties(new NodeSpec(node.label(), node.key(), props), node.naturalKey());
                nodesById.put(node.id(), new Node(node.id(), node.label(), node.key(),
                        Props.merge(node.properties(), props), node.createdAt(), now));
                updated++;
            }
        }
        for (Edge edge : new ArrayList<>(edgesById.values())) {
            if (match.matches(edge)) {
                edgesById.put(edge.id(), new Edge(edge.id(), edge.relationshipType(), edge.sourceId(), edge.targetId(),
                        edge.sourceLabel(), edge.sourceKey(), edge.targetLabel(), edge.targetKey(),
                        Props.merge(edge.properties(), props), edge.createdAt(), now));
                updated++;
            }
        }
        if (updated == 0) {
            throw new NotFoundException("No matching nodes or edges found for " + match);
        }
        return updated;
    }

    @Override
    public synchronized int deleteNode(MatchSpec match) {
        requireSelective(match);
        List<Node> doomed = nodesById.values().stream().filter(match::matches).toList();
        if (doomed.isEmpty()) {
            throw new NotFoundException("No matching nodes found for " + match);
        }
        for (Node node : doomed) {
            nodesById.remove(node.id());
            nodeIdsByKey.remove(node.naturalKey());
            List<Edge> attached = edgesById.values().stream()
                    .filter(e -> e.sourceId().equals(node.id()) || e.targetId().equals(node.id()))
                    .toList();
            attached.forEach(this::removeEdge);
        }
        return doomed.size();
    }

    @Override
    public synchronized int deleteEdge(MatchSpec match) {
        requireSelective(match);
        List<Edge> doomed = edgesById.values().stream().filter(match::matches).toList();
        if (doomed.isEmpty()) {
            throw new NotFoundException("No matching edges found for " + match);
        }
        doomed.forEach(this::removeEdge);
        return doomed.size();
    }

    @Override
    public synchronized List<Map<String, Object>> runQuery(String query, Map<String, Object> params) {
        Map<String, Object> p = params == null ? Map.of() : params;
        if (query == null) {
            throw new QueryException("Query name is required");
        }
        return switch (query) {
            case "all_nodes" -> rows(nodesById.values());
            case "nodes_by_label" -> rows(nodesById.values().stream()
                    .filter(n -> n.label().equals(required(p, "label"))).toList());
            case "node_by_key" -> rows(nodesById.values().stream()
                    .filter(n -> n.label().equals(required(p, "label")) && n.key().equals(required(p, "key")))
                    .toList());
            case "neighbors" -> {
                String nodeId = nodeIdsByKey.get(required(p, "label") + ":" + required(p, "key"));
                if (nodeId == null) {
                    yield List.of();
                }
                yield rows(getSubgraph(MatchSpec.byId(nodeId), 1).nodes().stream()
                        .filter(n -> !n.id().equals(nodeId)).toList());
            }
            case "count_nodes" -> {
                Object label = p.get("label");
                long count = nodesById.values().stream()
                        .filter(n -> label == null || n.label().equals(label))
                        .count();
                yield List.of(Map.of("count", count));
            }
            default -> throw new QueryException("Unknown query: " + query);
        };
    }

    @Override
    public synchronized GraphSnapshot getSubgraph(MatchSpec match, int depth) {
        if (depth < 0) {
            throw new ValidationException("Depth must be non-negative");
        }
        List<Node> central = nodesById.values().stream().filter(match::matches).toList();
        if (central.isEmpty()) {
            throw new NotFoundException("No matching nodes found for " + match);
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        Set<String> edgeIds = new LinkedHashSet<>();
        central.forEach(n -> nodeIds.add(n.id()));
        List<String> frontier = new ArrayList<>(nodeIds);

        for (int level = 0; level < depth && !frontier.isEmpty(); level++) {
            List<String> next = new ArrayList<>();
            for (String nodeId : frontier) {
                for (Edge edge : edgesById.values()) {
                    if (!edge.sourceId().equals(nodeId) && !edge.targetId().equals(nodeId)) {
                        continue;
                    }
                    edgeIds.add(edge.id());
                    String other = edge.sourceId().equals(nodeId) ? edge.targetId() : edge.sourceId();
                    if (nodeIds.add(other)) {
                        next.add(other);
                    }
                }
            }
            frontier = next;
        }

        return new GraphSnapshot(
                nodeIds.stream().map(nodesById::get).filter(Objects::nonNull).toList(),
                edgeIds.stream().map(edgesById::get).filter(Objects::nonNull).toList(),
                "subgraph " + match,
                depth,
                central.stream().map(Node::id).toList());
    }

    @Override
    public synchronized Optional<Node> findNode(String label, String key) {
        String nodeId = nodeIdsByKey.get(label + ":" + key);
        return nodeId == null ? Optional.empty() : Optional.of(nodesById.get(nodeId));
    }

    @Override
    public synchronized List<Node> allNodes() {
        return List.copyOf(nodesById.values());
    }

    public synchronized List<Edge> allEdges() {
        return List.copyOf(edgesById.values());
    }

    private void removeEdge(Edge edge) {
        edgesById.remove(edge.id());
        edgeIdsByKey.remove(edge.naturalKey());
    }

    private void checkUniqueProperties(NodeSpec spec, String ownerKey) {
        Set<String> unique = uniquePropertiesByLabel.getOrDefault(spec.label(), Set.of());
        for (String property : unique) {
            Object value = spec.properties().get(property);
            if (value == null) {
                continue;
            }
            for (Node node : nodesById.values()) {
                if (node.label().equals(spec.label())
                        && !node.naturalKey().equals(ownerKey)
                        && String.valueOf(value).equalsIgnoreCase(String.valueOf(node.properties().get(property)))) {
                    throw new ConstraintViolationException("Unique property " + spec.label() + "." + property
                            + " already used by " + node.naturalKey());
                }
            }
        }
    }

    private static void requireSelective(MatchSpec match) {
        if (match == null || match.isEmpty()) {
            throw new ValidationException("A match specification with at least one criterion is required");
        }
    }

    private static String required(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            throw new QueryException("Missing query parameter: " + name);
        }
        return value.toString();
    }

    private static List<Map<String, Object>> rows(Collection<Node> nodes) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Node node : nodes) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", node.id());
            row.put("label", node.label());
            row.put("key", node.key());
            row.put("properties", node.properties());
            rows.add(row);
        }
        return rows;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
