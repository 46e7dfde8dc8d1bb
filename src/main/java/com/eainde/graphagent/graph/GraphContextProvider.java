package com.eainde.graphagent.graph;

import com.eainde.graphagent.resolution.StringSimilarity;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the bounded {@link GraphSnapshot} that entity resolution works on.
 * <p>
 * Seeds are nodes whose key, name or any string property shares a token with
 * one of the mentions. Each seed is expanded to {@code maxDepth} hops and the
 * result is cut at {@code maxNodes}, seeds first.
 * </p>
 */
@Log4j2
public class GraphContextProvider {

    private final GraphStore graphStore;
    private final int maxDepth;
    private final int maxNodes;

    public GraphContextProvider(GraphStore graphStore, int maxDepth, int maxNodes) {
        this.graphStore = graphStore;
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    public GraphSnapshot snapshotFor(List<String> mentions) {
        String query = "context for " + mentions;
        if (mentions == null || mentions.isEmpty()) {
            return GraphSnapshot.empty(query);
        }

        Set<String> mentionTokens = new HashSet<>();
        mentions.forEach(m -> mentionTokens.addAll(tokens(m)));

        List<Node> seeds = graphStore.allNodes().stream()
                .filter(node -> overlaps(node, mentionTokens))
                .limit(maxNodes)
                .toList();
        if (seeds.isEmpty()) {
            log.debug("No graph context found for mentions {}", mentions);
            return GraphSnapshot.empty(query);
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        Map<String, Edge> edges = new LinkedHashMap<>();
        seeds.forEach(seed -> nodes.put(seed.id(), seed));
        for (Node seed : seeds) {
            GraphSnapshot neighbourhood = graphStore.getSubgraph(MatchSpec.byId(seed.id()), maxDepth);
            for (Node node : neighbourhood.nodes()) {
                if (nodes.size() >= maxNodes) {
                    break;
                }
                nodes.putIfAbsent(node.id(), node);
            }
            for (Edge edge : neighbourhood.edges()) {
                if (nodes.containsKey(edge.sourceId()) && nodes.containsKey(edge.targetId())) {
                    edges.putIfAbsent(edge.id(), edge);
                }
            }
        }

        log.debug("Graph context for {}: {} nodes, {} edges", mentions, nodes.size(), edges.size());
        return new GraphSnapshot(new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()), query, maxDepth,
                seeds.stream().map(Node::id).toList());
    }

    private static boolean overlaps(Node node, Set<String> mentionTokens) {
        Set<String> nodeTokens = new LinkedHashSet<>(tokens(node.key()));
        nodeTokens.addAll(tokens(node.name()));
        for (Object value : node.properties().values()) {
            if (value instanceof String text) {
                nodeTokens.addAll(tokens(text));
            }
        }
        for (String token : nodeTokens) {
            if (mentionTokens.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> tokens(String value) {
        String normalized = StringSimilarity.normalize(value);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
