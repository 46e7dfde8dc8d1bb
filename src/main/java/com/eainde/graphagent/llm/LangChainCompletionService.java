package com.eainde.graphagent.llm;

import com.eainde.graphagent.error.CompletionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

/**
 * {@link CompletionService} over a langchain4j {@link ChatModel} using a JSON-schema response format.
 */
@Log4j2
public class LangChainCompletionService implements CompletionService {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public LangChainCompletionService(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> T complete(CompletionRequest request, Class<T> type) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(request.systemPrompt()), UserMessage.from(request.userPrompt()))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(JsonSchemaConverter.toLangChainSchema(request.schemaName(), request.schemaJson()))
                        .build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RuntimeException e) {
            throw new CompletionException("Completion '" + request.schemaName() + "' failed: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new CompletionException("Completion '" + request.schemaName() + "' returned no content");
        }
        try {
            return objectMapper.readValue(stripFences(text), type);
        } catch (JsonProcessingException e) {
            log.warn("Completion '{}' did not match its schema: {}", request.schemaName(), text);
            throw new CompletionException("Completion '" + request.schemaName() + "' did not match its schema", e);
        }
    }

    private static String stripFences(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }
}
