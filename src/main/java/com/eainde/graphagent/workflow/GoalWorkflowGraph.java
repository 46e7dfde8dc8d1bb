package com.eainde.graphagent.workflow;

import com.eainde.graphagent.edges.DiagnosisRoutingEdge;
import com.eainde.graphagent.edges.EscalationRoutingEdge;
import com.eainde.graphagent.edges.EvaluationRoutingEdge;
import com.eainde.graphagent.edges.IntentRoutingEdge;
import com.eainde.graphagent.edges.PlanRoutingEdge;
import com.eainde.graphagent.edges.ResolutionRoutingEdge;
import com.eainde.graphagent.nodes.AnswerNode;
import com.eainde.graphagent.nodes.DiagnoseNode;
import com.eainde.graphagent.nodes.DisambiguateNode;
import com.eainde.graphagent.nodes.EscalateNode;
import com.eainde.graphagent.nodes.EscalationTimeoutNode;
import com.eainde.graphagent.nodes.EvaluateNode;
import com.eainde.graphagent.nodes.ExecuteToolNode;
import com.eainde.graphagent.nodes.ParseIntentNode;
import com.eainde.graphagent.nodes.PlanStepNode;
import com.eainde.graphagent.nodes.ResolveEntitiesNode;
import com.eainde.graphagent.state.GoalState;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import static com.eainde.graphagent.state.NodeName.ANSWER;
import static com.eainde.graphagent.state.NodeName.DIAGNOSE;
import static com.eainde.graphagent.state.NodeName.DISAMBIGUATE;
import static com.eainde.graphagent.state.NodeName.END;
import static com.eainde.graphagent.state.NodeName.ESCALATE;
import static com.eainde.graphagent.state.NodeName.ESCALATION_TIMEOUT;
import static com.eainde.graphagent.state.NodeName.EVALUATE;
import static com.eainde.graphagent.state.NodeName.EXECUTE_TOOL;
import static com.eainde.graphagent.state.NodeName.PARSE_INTENT;
import static com.eainde.graphagent.state.NodeName.PLAN_STEP;
import static com.eainde.graphagent.state.NodeName.RESOLVE_ENTITIES;

/**
 * Wiring of the goal session state machine on a LangGraph4j {@link StateGraph}:
 * <pre>
 * PARSE_INTENT -> RESOLVE_ENTITIES -> [DISAMBIGUATE] -> PLAN_STEP -> EXECUTE_TOOL -> EVALUATE
 *     EVALUATE -> PLAN_STEP | ANSWER | DIAGNOSE | ESCALATE
 *     DIAGNOSE -> PLAN_STEP | ESCALATE
 *     ESCALATE -> EXECUTE_TOOL | PLAN_STEP | PARSE_INTENT | END
 * ANSWER, ESCALATION_TIMEOUT -> END
 * </pre>
 * Suspended and terminal sessions leave through {@code END} from any node.
 */
@Component
public class GoalWorkflowGraph implements WorkflowDefinition {
    private final ParseIntentNode parseIntentNode;
    private final ResolveEntitiesNode resolveEntitiesNode;
    private final DisambiguateNode disambiguateNode;
    private final PlanStepNode planStepNode;
    private final ExecuteToolNode executeToolNode;
    private final EvaluateNode evaluateNode;
    private final DiagnoseNode diagnoseNode;
    private final EscalateNode escalateNode;
    private final AnswerNode answerNode;
    private final EscalationTimeoutNode escalationTimeoutNode;
    private final IntentRoutingEdge intentRoutingEdge;
    private final ResolutionRoutingEdge resolutionRoutingEdge;
    private final PlanRoutingEdge planRoutingEdge;
    private final EvaluationRoutingEdge evaluationRoutingEdge;
    private final DiagnosisRoutingEdge diagnosisRoutingEdge;
    private final EscalationRoutingEdge escalationRoutingEdge;

    public GoalWorkflowGraph(ParseIntentNode parseIntentNode,
                             ResolveEntitiesNode resolveEntitiesNode,
                             DisambiguateNode disambiguateNode,
                             PlanStepNode planStepNode,
                             ExecuteToolNode executeToolNode,
                             EvaluateNode evaluateNode,
                             DiagnoseNode diagnoseNode,
                             EscalateNode escalateNode,
                             AnswerNode answerNode,
                             EscalationTimeoutNode escalationTimeoutNode,
                             IntentRoutingEdge intentRoutingEdge,
                             ResolutionRoutingEdge resolutionRoutingEdge,
                             PlanRoutingEdge planRoutingEdge,
                             EvaluationRoutingEdge evaluationRoutingEdge,
                             DiagnosisRoutingEdge diagnosisRoutingEdge,
                             EscalationRoutingEdge escalationRoutingEdge) {
        this.parseIntentNode = parseIntentNode;
        this.resolveEntitiesNode = resolveEntitiesNode;
        this.disambiguateNode = disambiguateNode;
        this.planStepNode = planStepNode;
        this.executeToolNode = executeToolNode;
        this.evaluateNode = evaluateNode;
        this.diagnoseNode = diagnoseNode;
        this.escalateNode = escalateNode;
        this.answerNode = answerNode;
        this.escalationTimeoutNode = escalationTimeoutNode;
        this.intentRoutingEdge = intentRoutingEdge;
        this.resolutionRoutingEdge = resolutionRoutingEdge;
        this.planRoutingEdge = planRoutingEdge;
        this.evaluationRoutingEdge = evaluationRoutingEdge;
        this.diagnosisRoutingEdge = diagnosisRoutingEdge;
        this.escalationRoutingEdge = escalationRoutingEdge;
    }

    @Override
    public StateGraph<GoalState> define(TransitionGuard guard) throws GraphStateException {
        StateGraph<GoalState> workflow = new StateGraph<>(GoalState::new);

        WorkflowDefinition.addNode(workflow, guard, PARSE_INTENT, parseIntentNode);
        WorkflowDefinition.addNode(workflow, guard, RESOLVE_ENTITIES, resolveEntitiesNode);
        WorkflowDefinition.addNode(workflow, guard, DISAMBIGUATE, disambiguateNode);
        WorkflowDefinition.addNode(workflow, guard, PLAN_STEP, planStepNode);
        WorkflowDefinition.addNode(workflow, guard, EXECUTE_TOOL, executeToolNode);
        WorkflowDefinition.addNode(workflow, guard, EVALUATE, evaluateNode);
        WorkflowDefinition.addNode(workflow, guard, DIAGNOSE, diagnoseNode);
        WorkflowDefinition.addNode(workflow, guard, ESCALATE, escalateNode);
        WorkflowDefinition.addNode(workflow, guard, ANSWER, answerNode);
        WorkflowDefinition.addNode(workflow, guard, ESCALATION_TIMEOUT, escalationTimeoutNode);

        // start, resume and expiry enter wherever the session rests
        WorkflowDefinition.addEntry(workflow, PARSE_INTENT, DISAMBIGUATE, ESCALATE, ESCALATION_TIMEOUT);

        WorkflowDefinition.addRoutes(workflow, guard, PARSE_INTENT, intentRoutingEdge, RESOLVE_ENTITIES);
        WorkflowDefinition.addRoutes(workflow, guard, RESOLVE_ENTITIES, resolutionRoutingEdge,
                DISAMBIGUATE, EXECUTE_TOOL, PLAN_STEP);
        WorkflowDefinition.addRoutes(workflow, guard, DISAMBIGUATE, resolutionRoutingEdge,
                DISAMBIGUATE, EXECUTE_TOOL, PLAN_STEP);
        WorkflowDefinition.addRoutes(workflow, guard, PLAN_STEP, planRoutingEdge, EXECUTE_TOOL, EVALUATE);
        WorkflowDefinition.addRoutes(workflow, guard, EXECUTE_TOOL, state -> EVALUATE, EVALUATE);
        WorkflowDefinition.addRoutes(workflow, guard, EVALUATE, evaluationRoutingEdge, PLAN_STEP, ANSWER, DIAGNOSE);
        WorkflowDefinition.addRoutes(workflow, guard, DIAGNOSE, diagnosisRoutingEdge, PLAN_STEP);
        WorkflowDefinition.addRoutes(workflow, guard, ESCALATE, escalationRoutingEdge,
                EXECUTE_TOOL, PLAN_STEP, PARSE_INTENT);
        WorkflowDefinition.addRoutes(workflow, guard, ANSWER, state -> END);
        WorkflowDefinition.addRoutes(workflow, guard, ESCALATION_TIMEOUT, state -> END);

        return workflow;
    }
}
