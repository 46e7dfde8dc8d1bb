package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.CompletionException;
import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.llm.CompletionRequest;
import com.eainde.graphagent.llm.CompletionService;
import com.eainde.graphagent.model.GoalComplexity;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the model for a structured {@link IntentSpec}; falls back to the
 * heuristic parser when the completion fails.
 */
@Log4j2
public class LlmIntentParser implements IntentParser {

    static final String SCHEMA_NAME = "intent_spec";
    static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "intent_type": {"type": "string", "enum": ["CREATE", "QUERY", "UPDATE", "DELETE", "UNKNOWN"]},
                "mentions": {"type": "array", "items": {"type": "string"},
                             "description": "Entity names exactly as written in the goal"},
                "complexity": {"type": "string", "enum": ["SIMPLE", "MODERATE", "COMPLEX"]},
                "entity_type": {"type": "string", "description": "Label of the entity to create or find, if stated"},
                "relationship": {"type": "string"},
                "relationship_target": {"type": "string"},
                "properties": {"type": "array", "items": {
                  "type": "object",
                  "properties": {"name": {"type": "string"}, "value": {"type": "string"}},
                  "required": ["name", "value"]
                }}
              },
              "required": ["intent_type", "mentions", "complexity"]
            }
            """;

    private static final String SYSTEM_PROMPT = """
            You extract the intent of a request against a property graph.
            Do not resolve entities and never invent identifiers; copy entity names as written.
            """;

    private final CompletionService completionService;
    private final IntentParser fallback;

    public LlmIntentParser(CompletionService completionService, IntentParser fallback) {
        this.completionService = completionService;
        this.fallback = fallback;
    }

    @Override
    public IntentSpec parse(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new ValidationException("Goal must not be empty");
        }
        IntentDraft draft;
        try {
            draft = completionService.complete(
                    new CompletionRequest(SYSTEM_PROMPT, goal, SCHEMA_NAME, SCHEMA), IntentDraft.class);
        } catch (CompletionException e) {
            log.warn("Intent completion failed, using heuristic parser: {}", e.getMessage());
            return fallback.parse(goal);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        if (draft.properties() != null) {
            draft.properties().stream()
                    .filter(p -> p.name() != null && p.value() != null)
                    .forEach(p -> attributes.put(p.name(), p.value()));
        }
        putIfPresent(attributes, IntentSpec.TYPE, draft.entityType());
        putIfPresent(attributes, IntentSpec.RELATIONSHIP, draft.relationship());
        putIfPresent(attributes, IntentSpec.RELATIONSHIP_TARGET, draft.relationshipTarget());

        List<String> mentions = draft.mentions() == null ? List.of()
                : draft.mentions().stream().filter(m -> m != null && !m.isBlank()).map(String::trim).distinct().toList();
        return new IntentSpec(goal,
                draft.intentType() == null ? IntentType.UNKNOWN : draft.intentType(),
                mentions,
                draft.complexity() == null ? GoalComplexity.SIMPLE : draft.complexity(),
                !mentions.isEmpty(),
                attributes);
    }

    private static void putIfPresent(Map<String, String> attributes, String key, String value) {
        if (value != null && !value.isBlank()) {
            attributes.put(key, value);
        }
    }

    record IntentDraft(
            @JsonProperty("intent_type") IntentType intentType,
            @JsonProperty("mentions") List<String> mentions,
            @JsonProperty("complexity") GoalComplexity complexity,
            @JsonProperty("entity_type") String entityType,
            @JsonProperty("relationship") String relationship,
            @JsonProperty("relationship_target") String relationshipTarget,
            @JsonProperty("properties") List<PropertyDraft> properties
    ) {
    }

    record PropertyDraft(@JsonProperty("name") String name, @JsonProperty("value") String value) {
    }
}
