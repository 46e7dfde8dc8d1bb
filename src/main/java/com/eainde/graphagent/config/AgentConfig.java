package com.eainde.graphagent.config;

import com.eainde.graphagent.checkpoint.CheckpointMapper;
import com.eainde.graphagent.checkpoint.CheckpointSaver;
import com.eainde.graphagent.checkpoint.InMemoryCheckpointSaver;
import com.eainde.graphagent.checkpoint.JdbcCheckpointSaver;
import com.eainde.graphagent.context.ContextManager;
import com.eainde.graphagent.context.ProgressiveContextManager;
import com.eainde.graphagent.graph.GraphContextProvider;
import com.eainde.graphagent.graph.GraphStore;
import com.eainde.graphagent.graph.InMemoryGraphStore;
import com.eainde.graphagent.llm.LangChainCompletionService;
import com.eainde.graphagent.llm.ObservabilityListener;
import com.eainde.graphagent.pipeline.DefaultEscalationHandler;
import com.eainde.graphagent.pipeline.Diagnoser;
import com.eainde.graphagent.pipeline.DirectStepMapper;
import com.eainde.graphagent.pipeline.EscalationHandler;
import com.eainde.graphagent.pipeline.Evaluator;
import com.eainde.graphagent.pipeline.FailurePatternDiagnoser;
import com.eainde.graphagent.pipeline.HeuristicIntentParser;
import com.eainde.graphagent.pipeline.IntentParser;
import com.eainde.graphagent.pipeline.LlmIntentParser;
import com.eainde.graphagent.pipeline.LlmStepPlanner;
import com.eainde.graphagent.pipeline.RuleBasedEvaluator;
import com.eainde.graphagent.pipeline.RuleBasedStepPlanner;
import com.eainde.graphagent.pipeline.StepPlanner;
import com.eainde.graphagent.resolution.DeduplicationEngine;
import com.eainde.graphagent.resolution.DefaultResolutionRules;
import com.eainde.graphagent.resolution.EntityResolver;
import com.eainde.graphagent.resolution.GraphAwareEntityResolver;
import com.eainde.graphagent.resolution.SimilarityScorer;
import com.eainde.graphagent.thread.MdcAwareExecutor;
import com.eainde.graphagent.tools.GraphTools;
import com.eainde.graphagent.tools.ToolExecutor;
import com.eainde.graphagent.tools.ToolRegistry;
import com.eainde.graphagent.workflow.GoalWorkflowGraph;
import com.eainde.graphagent.workflow.Orchestrator;
import com.eainde.graphagent.workflow.TransitionListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Wires the agent core from {@link AgentProperties}.
 * <p>
 * The intent parser and step planner are LLM-backed when a langchain4j
 * {@link ChatModel} bean is present and rule-based otherwise. The checkpoint
 * store is picked by {@code graph-agent.checkpoint.store}.
 * </p>
 */
@Log4j2
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfig {

    // =========================================================================
    //  Infrastructure
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor toolWorkers(AgentProperties properties) {
        return new MdcAwareExecutor(properties.getTools().getThreads(), "graph-tool");
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor sessionExecutor(AgentProperties properties) {
        return new MdcAwareExecutor(properties.getOrchestration().getWorkerThreads(), "graph-session");
    }

    @Bean
    public ObservabilityListener observabilityListener() {
        return new ObservabilityListener();
    }

    // =========================================================================
    //  Graph and tools
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean(GraphStore.class)
    public GraphStore graphStore(AgentProperties properties, Clock clock) {
        return new InMemoryGraphStore(properties.getGraph().getUniqueProperties(), clock);
    }

    @Bean
    public ToolRegistry toolRegistry(GraphStore graphStore, AgentProperties properties) {
        return new ToolRegistry(GraphTools.all(graphStore, properties.getGraph().getMaxSubgraphDepth()));
    }

    @Bean
    public ToolExecutor toolExecutor(ToolRegistry toolRegistry, @Qualifier("toolWorkers") MdcAwareExecutor toolWorkers,
                                     AgentProperties properties) {
        return new ToolExecutor(toolRegistry, toolWorkers, properties.getTools().getTimeout());
    }

    @Bean
    public GraphContextProvider graphContextProvider(GraphStore graphStore, AgentProperties properties) {
        AgentProperties.Graph graph = properties.getGraph();
        return new GraphContextProvider(graphStore, graph.getContextDepth(), graph.getContextMaxNodes());
    }

    // =========================================================================
    //  Entity resolution
    // =========================================================================

    @Bean
    public EntityResolver entityResolver(AgentProperties properties, Clock clock) {
        AgentProperties.Resolution resolution = properties.getResolution();
        return new GraphAwareEntityResolver(
                new SimilarityScorer(resolution.weights()),
                new DefaultResolutionRules(),
                new DeduplicationEngine(DefaultResolutionRules.DEFAULT_UNIQUE_KEYS, resolution.getSourceRanking(), null),
                resolution.settings(),
                clock);
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    @Bean
    public DirectStepMapper directStepMapper() {
        return new DirectStepMapper();
    }

    @Bean
    public ContextManager contextManager(ToolRegistry toolRegistry, AgentProperties properties) {
        AgentProperties.Context context = properties.getContext();
        return new ProgressiveContextManager(toolRegistry, context.getMaxAttempts(), context.getHistoryWindow());
    }

    @Bean
    public IntentParser intentParser(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        HeuristicIntentParser heuristic = new HeuristicIntentParser();
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No ChatModel configured, using heuristic intent parsing");
            return heuristic;
        }
        return new LlmIntentParser(new LangChainCompletionService(model, objectMapper), heuristic);
    }

    @Bean
    public StepPlanner stepPlanner(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper,
                                   DirectStepMapper directStepMapper) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No ChatModel configured, using rule-based step planning");
            return new RuleBasedStepPlanner(directStepMapper);
        }
        return new LlmStepPlanner(new LangChainCompletionService(model, objectMapper), objectMapper);
    }

    @Bean
    public Evaluator evaluator() {
        return new RuleBasedEvaluator();
    }

    @Bean
    public Diagnoser diagnoser() {
        return new FailurePatternDiagnoser();
    }

    @Bean
    public EscalationHandler escalationHandler(Clock clock, AgentProperties properties) {
        AgentProperties.Orchestration orchestration = properties.getOrchestration();
        return new DefaultEscalationHandler(clock, orchestration.getEscalationTimeout(),
                orchestration.getMaxEscalationOptions());
    }

    // =========================================================================
    //  Orchestration
    // =========================================================================

    @Bean
    public CheckpointSaver checkpointSaver(AgentProperties properties, ObjectProvider<JdbcTemplate> jdbcTemplate) {
        AgentProperties.Checkpoint checkpoint = properties.getCheckpoint();
        if ("jdbc".equalsIgnoreCase(checkpoint.getStore())) {
            JdbcCheckpointSaver saver = new JdbcCheckpointSaver(jdbcTemplate.getObject(), new CheckpointMapper());
            if (checkpoint.isInitializeSchema()) {
                saver.initSchema();
            }
            log.info("Using JDBC checkpoint store");
            return saver;
        }
        log.info("Using in-memory checkpoint store");
        return new InMemoryCheckpointSaver();
    }

    @Bean
    public Orchestrator orchestrator(GoalWorkflowGraph goalWorkflow,
                                     CheckpointSaver checkpointSaver,
                                     List<TransitionListener> listeners,
                                     Clock clock,
                                     AgentProperties properties) {
        AgentProperties.Orchestration orchestration = properties.getOrchestration();
        return new Orchestrator(goalWorkflow, checkpointSaver, listeners, clock,
                orchestration.getMaxTransitions(), orchestration.getMaxRetries(), orchestration.getHistoryLimit());
    }
}
