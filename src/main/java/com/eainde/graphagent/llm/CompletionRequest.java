package com.eainde.graphagent.llm;

/**
 * A structured-output completion: prompts plus the JSON schema the answer must conform to.
 */
public record CompletionRequest(String systemPrompt, String userPrompt, String schemaName, String schemaJson) {
}
