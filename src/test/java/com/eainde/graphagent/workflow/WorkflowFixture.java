package com.eainde.graphagent.workflow;

import com.eainde.graphagent.checkpoint.InMemoryCheckpointSaver;
import com.eainde.graphagent.config.AgentProperties;
import com.eainde.graphagent.context.ProgressiveContextManager;
import com.eainde.graphagent.edges.DiagnosisRoutingEdge;
import com.eainde.graphagent.edges.EscalationRoutingEdge;
import com.eainde.graphagent.edges.EvaluationRoutingEdge;
import com.eainde.graphagent.edges.IntentRoutingEdge;
import com.eainde.graphagent.edges.PlanRoutingEdge;
import com.eainde.graphagent.edges.ResolutionRoutingEdge;
import com.eainde.graphagent.graph.GraphContextProvider;
import com.eainde.graphagent.graph.InMemoryGraphStore;
import com.eainde.graphagent.model.ConfidenceWeights;
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
import com.eainde.graphagent.pipeline.DefaultEscalationHandler;
import com.eainde.graphagent.pipeline.DirectStepMapper;
import com.eainde.graphagent.pipeline.FailurePatternDiagnoser;
import com.eainde.graphagent.pipeline.HeuristicIntentParser;
import com.eainde.graphagent.pipeline.IntentParser;
import com.eainde.graphagent.pipeline.RuleBasedEvaluator;
import com.eainde.graphagent.pipeline.RuleBasedStepPlanner;
import com.eainde.graphagent.pipeline.StepPlanner;
import com.eainde.graphagent.resolution.DeduplicationEngine;
import com.eainde.graphagent.resolution.DefaultResolutionRules;
import com.eainde.graphagent.resolution.GraphAwareEntityResolver;
import com.eainde.graphagent.resolution.ResolutionSettings;
import com.eainde.graphagent.resolution.SimilarityScorer;
import com.eainde.graphagent.tools.GraphTools;
import com.eainde.graphagent.tools.Tool;
import com.eainde.graphagent.tools.ToolExecutor;
import com.eainde.graphagent.tools.ToolRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The goal workflow wired with real components over an in-memory graph. Tools
 * run on the calling thread.
 */
public class WorkflowFixture {

    public static final Instant START = Instant.parse("2025-01-01T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryGraphStore store = new InMemoryGraphStore();
    public final InMemoryCheckpointSaver checkpointSaver = new InMemoryCheckpointSaver();
    public final DirectStepMapper stepMapper = new DirectStepMapper();
    public final GoalWorkflowGraph workflow;

    public WorkflowFixture() {
        this(new HeuristicIntentParser(), null, List.of());
    }

    /**
     * @param planner    null for the rule-based planner
     * @param extraTools registered next to the graph tools
     */
    public WorkflowFixture(IntentParser parser, StepPlanner planner, List<Tool> extraTools) {
        List<Tool> tools = new ArrayList<>(GraphTools.all(store, 3));
        tools.addAll(extraTools);
        ToolRegistry registry = new ToolRegistry(tools);
        ToolExecutor toolExecutor = new ToolExecutor(registry, Runnable::run, Duration.ofSeconds(5));
        ProgressiveContextManager contextManager = new ProgressiveContextManager(registry, 3, 10);
        GraphAwareEntityResolver resolver = new GraphAwareEntityResolver(
                new SimilarityScorer(ConfidenceWeights.defaults()),
                new DefaultResolutionRules(),
                new DeduplicationEngine(),
                ResolutionSettings.defaults(),
                clock);
        StepPlanner stepPlanner = planner == null ? new RuleBasedStepPlanner(stepMapper) : planner;

        workflow = new GoalWorkflowGraph(
                new ParseIntentNode(parser),
                new ResolveEntitiesNode(new GraphContextProvider(store, 2, 50), resolver, stepMapper),
                new DisambiguateNode(resolver, stepMapper, clock, new AgentProperties()),
                new PlanStepNode(stepPlanner, contextManager, clock),
                new ExecuteToolNode(toolExecutor, clock),
                new EvaluateNode(new RuleBasedEvaluator()),
                new DiagnoseNode(new FailurePatternDiagnoser(), contextManager),
                new EscalateNode(new DefaultEscalationHandler(clock, Duration.ofHours(1), 4), clock),
                new AnswerNode(),
                new EscalationTimeoutNode(clock),
                new IntentRoutingEdge(),
                new ResolutionRoutingEdge(),
                new PlanRoutingEdge(contextManager),
                new EvaluationRoutingEdge(),
                new DiagnosisRoutingEdge(),
                new EscalationRoutingEdge());
    }

    public Orchestrator orchestrator(List<TransitionListener> listeners) {
        return new Orchestrator(workflow, checkpointSaver, listeners, clock, 100, 3, 200);
    }

    public Orchestrator orchestrator() {
        return orchestrator(List.of());
    }
}
