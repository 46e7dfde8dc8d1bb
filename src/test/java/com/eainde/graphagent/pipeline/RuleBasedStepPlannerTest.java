package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.PlanningException;
import com.eainde.graphagent.model.IntentType;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.tools.GraphTools;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.eainde.graphagent.pipeline.DirectStepMapperTest.created;
import static com.eainde.graphagent.pipeline.DirectStepMapperTest.intent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleBasedStepPlannerTest {

    private final RuleBasedStepPlanner planner = new RuleBasedStepPlanner(new DirectStepMapper());
    private final ModelInput input = new ModelInput(1, List.of());

    private final SessionState twoNodes = SessionState.start("s", "Create A and B", 3, 100, Instant.EPOCH).toBuilder()
            .resolvedGoal(ResolvedGoalSpec.of(intent(IntentType.CREATE, List.of("A", "B"), Map.of()),
                    List.of(created("A"), created("B"))))
            .build();

    @Test
    void plan_shouldWalkThroughTheStepsInOrder() {
        PlannedStep first = planner.plan(twoNodes, input);
        PlannedStep second = planner.plan(twoNodes.toBuilder().completedSteps(1).build(), input);

        assertThat(first.signature().toolName()).isEqualTo(GraphTools.ADD_NODE);
        assertThat(first.signature().arguments()).containsEntry("key", "A");
        assertThat(first.finalStep()).isFalse();
        assertThat(second.signature().arguments()).containsEntry("key", "B");
        assertThat(second.finalStep()).isTrue();
    }

    @Test
    void plan_shouldFailWhenNothingIsLeft() {
        assertThatThrownBy(() -> planner.plan(twoNodes.toBuilder().completedSteps(2).build(), input))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("No steps left");
        assertThatThrownBy(() -> planner.plan(SessionState.start("s", "g", 3, 100, Instant.EPOCH), input))
                .isInstanceOf(PlanningException.class);
    }
}
