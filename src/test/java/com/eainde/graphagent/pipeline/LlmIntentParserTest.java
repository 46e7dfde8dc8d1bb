package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.CompletionException;
import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.llm.CompletionRequest;
import com.eainde.graphagent.llm.CompletionService;
import com.eainde.graphagent.llm.JsonSchemaConverter;
import com.eainde.graphagent.model.GoalComplexity;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmIntentParserTest {

    @Mock
    private CompletionService completionService;

    @Test
    void parse_shouldMapTheDraftIntoAnIntent() {
        // Arrange
        LlmIntentParser parser = new LlmIntentParser(completionService, new HeuristicIntentParser());
        when(completionService.complete(any(CompletionRequest.class), eq(LlmIntentParser.IntentDraft.class)))
                .thenReturn(new LlmIntentParser.IntentDraft(IntentType.CREATE, Arrays.asList(" Alice ", "", "Alice", null),
                        null, "Person", null, null,
                        List.of(new LlmIntentParser.PropertyDraft("email", "a@example.com"),
                                new LlmIntentParser.PropertyDraft("age", null))));

        // Act
        IntentSpec intent = parser.parse("Create Alice, a person with email a@example.com");

        // Assert
        assertThat(intent.intentType()).isEqualTo(IntentType.CREATE);
        assertThat(intent.mentions()).containsExactly("Alice");
        assertThat(intent.complexity()).isEqualTo(GoalComplexity.SIMPLE);
        assertThat(intent.entityType()).isEqualTo("Person");
        assertThat(intent.literalProperties()).containsOnlyKeys("email");
        assertThat(intent.requiresGraphContext()).isTrue();
    }

    @Test
    void parse_shouldFallBackToHeuristicsWhenTheModelFails() {
        LlmIntentParser parser = new LlmIntentParser(completionService, new HeuristicIntentParser());
        when(completionService.complete(any(CompletionRequest.class), eq(LlmIntentParser.IntentDraft.class)))
                .thenThrow(new CompletionException("timeout"));

        IntentSpec intent = parser.parse("Delete John");

        assertThat(intent.intentType()).isEqualTo(IntentType.DELETE);
        assertThat(intent.mentions()).containsExactly("John");
    }

    @Test
    void parse_shouldRejectBlankGoalsWithoutCallingTheModel() {
        LlmIntentParser parser = new LlmIntentParser(completionService, new HeuristicIntentParser());

        assertThatThrownBy(() -> parser.parse(" ")).isInstanceOf(ValidationException.class);
        verifyNoInteractions(completionService);
    }

    @Test
    void schema_shouldConvertToALangChainSchema() {
        assertThat(JsonSchemaConverter.toLangChainSchema(LlmIntentParser.SCHEMA_NAME, LlmIntentParser.SCHEMA)
                .rootElement()).isNotNull();
    }
}
