package com.eainde.graphagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the first, cheap parsing pass: what the user wants to do and which
 * surface strings refer to entities. Nothing here is bound to the graph yet.
 * <p>
 * {@code attributes} carries hints read from the goal. The reserved keys are
 * {@link #TYPE}, {@link #RELATIONSHIP} and {@link #RELATIONSHIP_TARGET}; every
 * other entry is a literal property given as {@code key=value}.
 * </p>
 */
public record IntentSpec(
        String goal,
        IntentType intentType,
        List<String> mentions,
        GoalComplexity complexity,
        boolean requiresGraphContext,
        Map<String, String> attributes
) {
    public static final String TYPE = "type";
    public static final String RELATIONSHIP = "relationship";
    public static final String RELATIONSHIP_TARGET = "relationship_target";

    public IntentSpec {
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        intentType = intentType == null ? IntentType.UNKNOWN : intentType;
        complexity = complexity == null ? GoalComplexity.SIMPLE : complexity;
    }

    @JsonIgnore
    public boolean isSimple() {
        return complexity == GoalComplexity.SIMPLE && mentions.size() <= 2;
    }

    public String entityType() {
        return attributes.get(TYPE);
    }

    public String relationship() {
        return attributes.get(RELATIONSHIP);
    }

    public String relationshipTarget() {
        return attributes.get(RELATIONSHIP_TARGET);
    }

    public Map<String, Object> literalProperties() {
        Map<String, Object> literals = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (!TYPE.equals(key) && !RELATIONSHIP.equals(key) && !RELATIONSHIP_TARGET.equals(key)) {
                literals.put(key, value);
            }
        });
        return literals;
    }
}
