package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.CompletionException;
import com.eainde.graphagent.error.PlanningException;
import com.eainde.graphagent.llm.CompletionRequest;
import com.eainde.graphagent.llm.CompletionService;
import com.eainde.graphagent.llm.JsonSchemaConverter;
import com.eainde.graphagent.model.ContextSection;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.state.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmStepPlannerTest {

    @Mock
    private CompletionService completionService;

    private LlmStepPlanner planner;
    private final SessionState state = SessionState.start("s", "Create 'Alice'", 3, 100, Instant.EPOCH);
    private final ModelInput input = new ModelInput(2, List.of(
            new ContextSection("goal", "Create 'Alice'"),
            new ContextSection("latest_error", "[VALIDATION] add_node {}: missing key")));

    @BeforeEach
    void setUp() {
        planner = new LlmStepPlanner(completionService, new ObjectMapper());
    }

    private void answer(LlmStepPlanner.StepDraft draft) {
        when(completionService.complete(any(CompletionRequest.class), eq(LlmStepPlanner.StepDraft.class)))
                .thenReturn(draft);
    }

    @Test
    void plan_shouldParseArgumentsAndSendTheDisclosedContext() {
        // Arrange
        answer(new LlmStepPlanner.StepDraft("add_node",
                "{\"label\": \"Person\", \"key\": \"Alice\", \"properties\": {\"name\": \"Alice\"}}", true, "create"));

        // Act
        PlannedStep step = planner.plan(state, input);

        // Assert
        assertThat(step.signature().toolName()).isEqualTo("add_node");
        assertThat(step.signature().arguments())
                .containsEntry("label", "Person")
                .containsEntry("properties", Map.of("name", "Alice"));
        assertThat(step.finalStep()).isTrue();
        assertThat(step.rationale()).isEqualTo("create");

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionService).complete(captor.capture(), eq(LlmStepPlanner.StepDraft.class));
        assertThat(captor.getValue().userPrompt()).contains("## latest_error").contains("missing key");
        assertThat(captor.getValue().schemaName()).isEqualTo(LlmStepPlanner.SCHEMA_NAME);
    }

    @Test
    void plan_shouldRejectIdentifierArguments() {
        answer(new LlmStepPlanner.StepDraft("delete_node", "{\"node_id\": \"4f1c\"}", true, null));

        assertThatThrownBy(() -> planner.plan(state, input))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("node_id");
    }

    @Test
    void plan_shouldRejectArgumentsThatAreNotAnObject() {
        answer(new LlmStepPlanner.StepDraft("add_node", "[1, 2]", false, null));

        assertThatThrownBy(() -> planner.plan(state, input)).isInstanceOf(PlanningException.class);
    }

    @Test
    void plan_shouldTurnCompletionFailuresIntoPlanningFailures() {
        when(completionService.complete(any(CompletionRequest.class), eq(LlmStepPlanner.StepDraft.class)))
                .thenThrow(new CompletionException("model offline"));

        assertThatThrownBy(() -> planner.plan(state, input))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("model offline")
                .hasCauseInstanceOf(CompletionException.class);
    }

    @Test
    void plan_shouldDefaultMissingFinalStepToFalse() {
        answer(new LlmStepPlanner.StepDraft("query_graph", null, null, null));

        PlannedStep step = planner.plan(state, input);

        assertThat(step.finalStep()).isFalse();
        assertThat(step.signature().arguments()).isEmpty();
    }

    @Test
    void schema_shouldConvertToALangChainSchema() {
        assertThat(JsonSchemaConverter.toLangChainSchema(LlmStepPlanner.SCHEMA_NAME, LlmStepPlanner.SCHEMA).name())
                .isEqualTo("planned_step");
    }
}
