package com.eainde.graphagent.llm;

import com.eainde.graphagent.error.CompletionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the JSON schema text of a {@link CompletionRequest} into a langchain4j {@link JsonSchema}.
 * Only the subset used by the parser and planner prompts is supported: objects,
 * arrays, enums and the scalar types. A node without {@code type} is an object
 * when it declares properties and a string otherwise.
 */
public final class JsonSchemaConverter {

    static final String DEFAULT_NAME = "Response";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String schemaJson) {
        JsonNode root;
        try {
            root = MAPPER.readTree(schemaJson);
        } catch (JsonProcessingException e) {
            throw new CompletionException("Invalid response schema '" + name + "'", e);
        }
        if (root == null || !root.isObject()) {
            throw new CompletionException("Response schema '" + name + "' is not a JSON object");
        }
        return JsonSchema.builder()
                .name(name == null ? DEFAULT_NAME : name)
                .rootElement(element(root))
                .build();
    }

    private static JsonSchemaElement element(JsonNode node) {
        String description = node.path("description").isTextual() ? node.get("description").asText() : null;
        String type = node.path("type").asText(node.has("properties") ? "object" : "string");
        switch (type) {
            case "object":
                return object(node, description);
            case "array":
                JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
                if (node.has("items")) {
                    array.items(element(node.get("items")));
                }
                return array.build();
            case "integer":
                return JsonIntegerSchema.builder().description(description).build();
            case "number":
                return JsonNumberSchema.builder().description(description).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            default:
                List<String> allowed = texts(node.path("enum"));
                if (!allowed.isEmpty()) {
                    return JsonEnumSchema.builder().description(description).enumValues(allowed).build();
                }
                return JsonStringSchema.builder().description(description).build();
        }
    }

    private static JsonObjectSchema object(JsonNode node, String description) {
        JsonObjectSchema.Builder object = JsonObjectSchema.builder().description(description);
        node.path("properties").fields()
                .forEachRemaining(property -> object.addProperty(property.getKey(), element(property.getValue())));
        List<String> required = texts(node.path("required"));
        if (!required.isEmpty()) {
            object.required(required);
        }
        JsonNode additional = node.path("additionalProperties");
        if (additional.isBoolean()) {
            object.additionalProperties(additional.asBoolean());
        }
        return object.build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(value -> values.add(value.asText()));
        }
        return values;
    }
}
