package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.PlanningException;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.model.ResolutionStrategy;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.tools.GraphTools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a resolved goal straight to tool calls, without a model.
 *
 * <ul>
 * <li>CREATE: {@code add_node} per mention (idempotent for existing ones), then
 * {@code add_edge} when a relationship was requested</li>
 * <li>UPDATE: {@code update_props} per existing mention</li>
 * <li>DELETE: {@code delete_node} per existing mention</li>
 * <li>QUERY: {@code get_subgraph} around the first existing mention, otherwise a
 * {@code query_graph} by label or over all nodes</li>
 * </ul>
 */
public class DirectStepMapper {

    static final String DEFAULT_LABEL = "Entity";

    public List<ToolSignature> steps(ResolvedGoalSpec goal) {
        List<EntityResolution> resolutions = goal.requireBindings();
        IntentSpec intent = goal.intent();
        return switch (intent.intentType()) {
            case CREATE -> createSteps(intent, resolutions);
            case UPDATE -> updateSteps(intent, resolutions);
            case DELETE -> deleteSteps(resolutions);
            case QUERY -> List.of(querySteps(intent, resolutions));
            case UNKNOWN -> throw new PlanningException("Cannot map an unknown intent to graph operations");
        };
    }

    /**
     * The single call for a simple goal, if it needs exactly one.
     */
    public Optional<ToolSignature> directStep(ResolvedGoalSpec goal) {
        IntentSpec intent = goal.intent();
        if (!goal.readyToExecute() || !intent.isSimple() || intent.intentType() == IntentType.UNKNOWN) {
            return Optional.empty();
        }
        try {
            List<ToolSignature> steps = steps(goal);
            return steps.size() == 1 ? Optional.of(steps.get(0)) : Optional.empty();
        } catch (PlanningException e) {
            return Optional.empty();
        }
    }

    private static List<ToolSignature> createSteps(IntentSpec intent, List<EntityResolution> resolutions) {
        if (resolutions.isEmpty()) {
            throw new PlanningException("Nothing to create: the goal names no entity");
        }
        String target = intent.relationshipTarget();
        List<ToolSignature> steps = new ArrayList<>();
        for (int i = 0; i < resolutions.size(); i++) {
            EntityResolution resolution = resolutions.get(i);
            boolean primary = i == 0;
            boolean isTarget = resolution.mention().equals(target);
            if (isTarget && resolution.strategy() == ResolutionStrategy.USE_EXISTING) {
                continue;
            }
            Map<String, Object> properties = new LinkedHashMap<>();
            if (resolution.strategy() == ResolutionStrategy.CREATE_NEW) {
                properties.put("name", resolution.mention());
            }
            if (primary) {
                properties.putAll(intent.literalProperties());
            }
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("label", labelFor(resolution, isTarget ? null : intent.entityType()));
            args.put("key", keyFor(resolution));
            if (!properties.isEmpty()) {
                args.put("properties", properties);
            }
            steps.add(ToolSignature.of(GraphTools.ADD_NODE, args));
        }

        if (intent.relationship() != null && target != null) {
            EntityResolution source = resolutions.get(0);
            EntityResolution targetResolution = resolutions.stream()
                    .filter(r -> r.mention().equals(target))
                    .findFirst()
                    .orElseThrow(() -> new PlanningException("Relationship target '" + target + "' was not resolved"));
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("type", intent.relationship());
            args.put("source_label", labelFor(source, intent.entityType()));
            args.put("source_key", keyFor(source));
            args.put("target_label", labelFor(targetResolution, null));
            args.put("target_key", keyFor(targetResolution));
            steps.add(ToolSignature.of(GraphTools.ADD_EDGE, args));
        }
        return steps;
    }

    private static List<ToolSignature> updateSteps(IntentSpec intent, List<EntityResolution> resolutions) {
        Map<String, Object> properties = intent.literalProperties();
        if (properties.isEmpty()) {
            throw new PlanningException("No properties to update; give them as key=value");
        }
        List<ToolSignature> steps = new ArrayList<>();
        for (EntityResolution resolution : existing(resolutions, "update")) {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("label", resolution.entityLabel());
            args.put("key", resolution.entityKey());
            args.put("properties", properties);
            steps.add(ToolSignature.of(GraphTools.UPDATE_PROPS, args));
        }
        return steps;
    }

    private static List<ToolSignature> deleteSteps(List<EntityResolution> resolutions) {
        List<ToolSignature> steps = new ArrayList<>();
        for (EntityResolution resolution : existing(resolutions, "delete")) {
            steps.add(ToolSignature.of(GraphTools.DELETE_NODE,
                    Map.of("label", resolution.entityLabel(), "key", resolution.entityKey())));
        }
        return steps;
    }

    private static ToolSignature querySteps(IntentSpec intent, List<EntityResolution> resolutions) {
        Optional<EntityResolution> anchor = resolutions.stream()
                .filter(r -> r.strategy() == ResolutionStrategy.USE_EXISTING)
                .findFirst();
        if (anchor.isPresent()) {
            return ToolSignature.of(GraphTools.GET_SUBGRAPH,
                    Map.of("label", anchor.get().entityLabel(), "key", anchor.get().entityKey(), "depth", 1));
        }
        if (intent.entityType() != null) {
            return ToolSignature.of(GraphTools.QUERY_GRAPH,
                    Map.of("query", "nodes_by_label", "params", Map.of("label", intent.entityType())));
        }
        return ToolSignature.of(GraphTools.QUERY_GRAPH, Map.of("query", "all_nodes"));
    }

    private static List<EntityResolution> existing(List<EntityResolution> resolutions, String verb) {
        if (resolutions.isEmpty()) {
            throw new PlanningException("Nothing to " + verb + ": the goal names no entity");
        }
        for (EntityResolution resolution : resolutions) {
            if (resolution.strategy() != ResolutionStrategy.USE_EXISTING) {
                throw new PlanningException("Cannot " + verb + " '" + resolution.mention()
                        + "': no such entity in the graph");
            }
        }
        return resolutions;
    }

    private static String labelFor(EntityResolution resolution, String typeHint) {
        if (resolution.strategy() == ResolutionStrategy.USE_EXISTING && resolution.entityLabel() != null) {
            return resolution.entityLabel();
        }
        return typeHint != null ? typeHint : DEFAULT_LABEL;
    }

    private static String keyFor(EntityResolution resolution) {
        if (resolution.strategy() == ResolutionStrategy.USE_EXISTING && resolution.entityKey() != null) {
            return resolution.entityKey();
        }
        return resolution.mention();
    }
}
