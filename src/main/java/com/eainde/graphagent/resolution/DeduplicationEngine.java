package com.eainde.graphagent.resolution;

import com.eainde.graphagent.model.EntityCandidate;
import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds and merges near-duplicate candidates.
 * <p>
 * Pairwise similarity is {@code 0.7 * nameRatio + 0.3 * propertyAgreement},
 * where agreement is the share of shared, non-null properties with equal
 * values. Pairs without shared properties are compared on the name alone, and a
 * shared unique-key value makes a pair identical. Clusters are the connected
 * components of the "similar enough" relation, so merging is transitive.
 * </p>
 */
@Log4j2
public class DeduplicationEngine {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private static final double NAME_WEIGHT = 0.7;
    private static final double PROPERTY_WEIGHT = 0.3;

    private final Set<String> uniqueKeyProperties;
    private final List<String> sourceRanking;
    private final PropertyConflictResolver customResolver;

    public DeduplicationEngine() {
        this(DefaultResolutionRules.DEFAULT_UNIQUE_KEYS, List.of(), null);
    }

    public DeduplicationEngine(Set<String> uniqueKeyProperties, List<String> sourceRanking,
                               PropertyConflictResolver customResolver) {
        this.uniqueKeyProperties = Set.copyOf(uniqueKeyProperties);
        this.sourceRanking = List.copyOf(sourceRanking);
        this.customResolver = customResolver;
    }

    public double similarity(EntityCandidate a, EntityCandidate b) {
        if (Objects.equals(a.id(), b.id()) || sharesUniqueKey(a, b)) {
            return 1.0;
        }
        double nameRatio = StringSimilarity.ratio(StringSimilarity.normalize(a.name()), StringSimilarity.normalize(b.name()));
        int shared = 0;
        int agreeing = 0;
        for (Map.Entry<String, Object> entry : a.properties().entrySet()) {
            if ("name".equals(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            Object other = b.properties().get(entry.getKey());
            if (other == null) {
                continue;
            }
            shared++;
            if (entry.getValue().toString().equalsIgnoreCase(other.toString())) {
                agreeing++;
            }
        }
        if (shared == 0) {
            return nameRatio;
        }
        return NAME_WEIGHT * nameRatio + PROPERTY_WEIGHT * ((double) agreeing / shared);
    }

    public List<List<EntityCandidate>> findDuplicates(List<EntityCandidate> candidates) {
        return findDuplicates(candidates, DEFAULT_THRESHOLD);
    }

    /**
     * @return clusters with at least two members, in order of their first member
     */
    public List<List<EntityCandidate>> findDuplicates(List<EntityCandidate> candidates, double threshold) {
        int[] parent = new int[candidates.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                if (similarity(candidates.get(i), candidates.get(j)) >= threshold) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<EntityCandidate>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(candidates.get(i));
        }
        List<List<EntityCandidate>> clusters = byRoot.values().stream().filter(c -> c.size() > 1).toList();
        if (!clusters.isEmpty()) {
            log.debug("Found {} duplicate clusters among {} candidates", clusters.size(), candidates.size());
        }
        return clusters;
    }

    /**
     * Folds a cluster into its primary member. Merging an already merged
     * candidate on its own returns an equal candidate.
     */
    public EntityCandidate merge(List<EntityCandidate> cluster, MergeStrategy strategy) {
        if (cluster == null || cluster.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty cluster");
        }
        if (strategy == MergeStrategy.CUSTOM && customResolver == null) {
            throw new IllegalStateException("CUSTOM merge strategy requires a PropertyConflictResolver");
        }
        List<EntityCandidate> ordered = preferenceOrder(cluster, strategy);
        EntityCandidate primary = ordered.get(0);

        Set<String> keys = new LinkedHashSet<>();
        ordered.forEach(c -> keys.addAll(c.properties().keySet()));
        Map<String, Object> properties = new LinkedHashMap<>();
        for (String key : keys) {
            properties.put(key, resolveProperty(key, ordered, strategy));
        }

        Set<String> mergedFrom = new TreeSet<>();
        for (EntityCandidate candidate : cluster) {
            mergedFrom.add(candidate.id());
            mergedFrom.addAll(candidate.mergedFrom());
        }
        mergedFrom.remove(primary.id());

        double similarity = cluster.stream().mapToDouble(EntityCandidate::similarity).max().orElse(0.0);
        Instant updatedAt = cluster.stream().map(EntityCandidate::updatedAt).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);

        return new EntityCandidate(primary.id(), primary.name(), primary.label(), primary.key(), properties,
                similarity, primary.source(), updatedAt, new ArrayList<>(mergedFrom));
    }

    private List<EntityCandidate> preferenceOrder(List<EntityCandidate> cluster, MergeStrategy strategy) {
        List<EntityCandidate> ordered = new ArrayList<>(cluster);
        Comparator<EntityCandidate> comparator = switch (strategy) {
            case PRESERVE_LATEST -> Comparator.comparing(EntityCandidate::updatedAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
            // fewest gaps over the cluster's properties first
            case PRESERVE_MOST_COMPLETE -> Comparator.comparingLong(DeduplicationEngine::presentValues).reversed();
            case PRESERVE_MOST_AUTHORITATIVE -> Comparator.comparingInt(this::sourceRank);
            case CUSTOM -> (a, b) -> 0;
        };
        ordered.sort(comparator);
        return ordered;
    }

    private Object resolveProperty(String key, List<EntityCandidate> ordered, MergeStrategy strategy) {
        List<Object> values = new ArrayList<>();
        for (EntityCandidate candidate : ordered) {
            Object value = candidate.properties().get(key);
            if (value != null && !values.contains(value)) {
                values.add(value);
            }
        }
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        return switch (strategy) {
            case CUSTOM -> customResolver.resolve(key, List.copyOf(values));
            default -> values.get(0);
        };
    }

    private int sourceRank(EntityCandidate candidate) {
        int rank = sourceRanking.indexOf(candidate.source());
        return rank < 0 ? Integer.MAX_VALUE : rank;
    }

    private static long presentValues(EntityCandidate candidate) {
        return candidate.properties().values().stream().filter(Objects::nonNull).count();
    }

    private boolean sharesUniqueKey(EntityCandidate a, EntityCandidate b) {
        if (a.label() != null && a.label().equals(b.label()) && a.key() != null && a.key().equals(b.key())) {
            return true;
        }
        for (String property : uniqueKeyProperties) {
            Object left = a.properties().get(property);
            Object right = b.properties().get(property);
            if (left != null && right != null && left.toString().equalsIgnoreCase(right.toString())) {
                return true;
            }
        }
        return false;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[rootB] = rootA;
        }
    }
}
