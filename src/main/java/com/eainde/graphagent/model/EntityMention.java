package com.eainde.graphagent.model;

import com.eainde.graphagent.graph.Props;

import java.util.List;
import java.util.Map;

/**
 * A surface string from the goal that may refer to a graph entity.
 *
 * @param typeHint   label the user asked for, if any
 * @param properties literal properties given alongside the mention
 * @param coMentions the other mentions of the same goal, used for context matching
 */
public record EntityMention(
        String surfaceForm,
        String canonicalId,
        List<EntityCandidate> candidates,
        String typeHint,
        Map<String, Object> properties,
        List<String> coMentions
) {
    public EntityMention {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        properties = Props.copyOf(properties);
        coMentions = coMentions == null ? List.of() : List.copyOf(coMentions);
    }

    public static EntityMention of(String surfaceForm) {
        return new EntityMention(surfaceForm, null, List.of(), null, Map.of(), List.of());
    }

    public static EntityMention of(String surfaceForm, String typeHint) {
        return new EntityMention(surfaceForm, null, List.of(), typeHint, Map.of(), List.of());
    }
}
