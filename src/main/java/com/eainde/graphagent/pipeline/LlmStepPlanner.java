package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.CompletionException;
import com.eainde.graphagent.error.PlanningException;
import com.eainde.graphagent.llm.CompletionRequest;
import com.eainde.graphagent.llm.CompletionService;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.state.SessionState;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Asks the model for the next tool call given the disclosed context. The model
 * addresses entities by label and key only; any identifier argument is rejected.
 */
@Log4j2
public class LlmStepPlanner implements StepPlanner {

    static final String SCHEMA_NAME = "planned_step";
    static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "tool_name": {"type": "string"},
                "arguments_json": {"type": "string", "description": "Tool arguments as a JSON object"},
                "final_step": {"type": "boolean", "description": "True if the goal is complete after this call"},
                "rationale": {"type": "string"}
              },
              "required": ["tool_name", "arguments_json", "final_step"]
            }
            """;

    private static final String SYSTEM_PROMPT = """
            You plan exactly one graph tool call at a time.
            Use only the listed tools and address entities by label and key.
            Never invent identifiers.
            """;

    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    public LlmStepPlanner(CompletionService completionService, ObjectMapper objectMapper) {
        this.completionService = completionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public PlannedStep plan(SessionState state, ModelInput input) {
        String userPrompt = input.render() + "\n\nCompleted steps so far: " + state.completedSteps();
        StepDraft draft;
        try {
            draft = completionService.complete(
                    new CompletionRequest(SYSTEM_PROMPT, userPrompt, SCHEMA_NAME, SCHEMA), StepDraft.class);
        } catch (CompletionException e) {
            throw new PlanningException("Planner completion failed: " + e.getMessage(), e);
        }
        if (draft.toolName() == null || draft.toolName().isBlank()) {
            throw new PlanningException("Planner returned no tool name");
        }

        Map<String, Object> arguments;
        try {
            arguments = draft.argumentsJson() == null || draft.argumentsJson().isBlank()
                    ? Map.of()
                    : objectMapper.readValue(draft.argumentsJson(), new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new PlanningException("Planner returned arguments that are not a JSON object", e);
        }
        for (String name : arguments.keySet()) {
            if (name.equals("id") || name.endsWith("_id")) {
                throw new PlanningException("Argument '" + name + "' looks like an identifier; "
                        + "address entities by label and key");
            }
        }

        log.info("Planned {} (attempt {}, final={})", draft.toolName(), input.attempt(), draft.finalStep());
        return new PlannedStep(ToolSignature.of(draft.toolName(), arguments),
                Boolean.TRUE.equals(draft.finalStep()), draft.rationale());
    }

    record StepDraft(
            @JsonProperty("tool_name") String toolName,
            @JsonProperty("arguments_json") String argumentsJson,
            @JsonProperty("final_step") Boolean finalStep,
            @JsonProperty("rationale") String rationale
    ) {
    }
}
