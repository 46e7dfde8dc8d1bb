package com.eainde.graphagent.llm;

import com.eainde.graphagent.error.CompletionException;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    // --- Tests for toLangChainSchema ---

    @Test
    void toLangChainSchema_shouldParseObjectWithEnumsAndRequiredFields() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "intent_type": {"type": "string", "enum": ["CREATE", "DELETE"]},
                    "final_step": {"type": "boolean", "description": "Done after this call"},
                    "rationale": {"type": "string"}
                  },
                  "required": ["intent_type"]
                }
                """;

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("step", json);

        // Assert
        assertThat(result.name()).isEqualTo("step");
        assertThat(result.rootElement()).isInstanceOf(JsonObjectSchema.class);
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties()).containsOnlyKeys("intent_type", "final_step", "rationale");
        assertThat(root.properties().get("intent_type")).isInstanceOf(JsonEnumSchema.class);
        assertThat(((JsonEnumSchema) root.properties().get("intent_type")).enumValues())
                .containsExactly("CREATE", "DELETE");
        assertThat(root.properties().get("final_step")).isInstanceOf(JsonBooleanSchema.class);
        assertThat(root.properties().get("final_step").description()).isEqualTo("Done after this call");
        assertThat(root.properties().get("rationale")).isInstanceOf(JsonStringSchema.class);
        assertThat(root.required()).containsExactly("intent_type");
    }

    @Test
    void toLangChainSchema_shouldParseArraysOfObjects() {
        // Arrange
        String json = """
                {"type": "object", "properties": {
                  "properties": {"type": "array", "items": {
                    "type": "object", "properties": {"name": {"type": "string"}}}}}}
                """;

        // Act
        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("x", json).rootElement();

        // Assert
        assertThat(root.properties().get("properties")).isInstanceOf(JsonArraySchema.class);
        JsonArraySchema array = (JsonArraySchema) root.properties().get("properties");
        assertThat(array.items()).isInstanceOf(JsonObjectSchema.class);
    }

    @Test
    void toLangChainSchema_shouldDefaultTheName() {
        JsonSchema result = JsonSchemaConverter.toLangChainSchema(null, "{\"type\": \"object\"}");

        assertThat(result.name()).isEqualTo("Response");
    }

    @Test
    void toLangChainSchema_shouldRejectMalformedJson() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("bad", "{ not json"))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("bad");
    }
}
