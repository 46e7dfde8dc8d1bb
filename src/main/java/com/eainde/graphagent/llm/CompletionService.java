package com.eainde.graphagent.llm;

/**
 * The language model, seen as a function from prompt to schema-conforming object.
 */
public interface CompletionService {

    /**
     * @throws com.eainde.graphagent.error.CompletionException if the model fails or answers off-schema
     */
    <T> T complete(CompletionRequest request, Class<T> type);
}
