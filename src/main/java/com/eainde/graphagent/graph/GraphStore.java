package com.eainde.graphagent.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract of the backing property graph.
 * <p>
 * All upserts are idempotent under the natural key: repeating an identical call
 * returns the same entity and changes nothing beyond the update timestamp.
 * Implementations must be safe for concurrent use by multiple sessions.
 * </p>
 */
public interface GraphStore {

    /**
     * @throws com.eainde.graphagent.error.ValidationException if label or key is missing
     * @throws com.eainde.graphagent.error.ConstraintViolationException if a unique property is already taken
     */
    Node upsertNode(NodeSpec spec);

    /**
     * @throws com.eainde.graphagent.error.NotFoundException if either endpoint does not exist
     */
    Edge upsertEdge(EdgeSpec spec);

    /**
     * Merges {@code props} into every node and edge matching {@code match}.
     *
     * @return number of updated elements
     * @throws com.eainde.graphagent.error.NotFoundException if nothing matched
     */
    int updateProps(MatchSpec match, Map<String, Object> props);

    /**
     * Deletes matching nodes together with their edges.
     *
     * @throws com.eainde.graphagent.error.NotFoundException if nothing matched
     */
    int deleteNode(MatchSpec match);

    /**
     * @throws com.eainde.graphagent.error.NotFoundException if nothing matched
     */
    int deleteEdge(MatchSpec match);

    /**
     * Runs a named query.
     *
     * @throws com.eainde.graphagent.error.QueryException if the query is unknown or fails
     */
    List<Map<String, Object>> runQuery(String query, Map<String, Object> params);

    /**
     * @throws com.eainde.graphagent.error.NotFoundException if no central node matched
     */
    GraphSnapshot getSubgraph(MatchSpec match, int depth);

    Optional<Node> findNode(String label, String key);

    List<Node> allNodes();
}
