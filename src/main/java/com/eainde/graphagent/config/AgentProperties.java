package com.eainde.graphagent.config;

import com.eainde.graphagent.model.ConfidenceWeights;
import com.eainde.graphagent.resolution.MergeStrategy;
import com.eainde.graphagent.resolution.ResolutionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings bound from {@code graph-agent.*}. Defaults match the values the
 * components use when built without Spring.
 */
@Data
@ConfigurationProperties(prefix = "graph-agent")
public class AgentProperties {

    private Resolution resolution = new Resolution();
    private Context context = new Context();
    private Orchestration orchestration = new Orchestration();
    private Tools tools = new Tools();
    private Graph graph = new Graph();
    private Checkpoint checkpoint = new Checkpoint();

    @Data
    public static class Resolution {
        private double nameWeight = 0.4;
        private double typeWeight = 0.3;
        private double propertyWeight = 0.2;
        private double contextWeight = 0.1;
        private double useExistingThreshold = 0.95;
        private double createNewThreshold = 0.3;
        private double singleCandidateAcceptThreshold = 0.7;
        private double tieTolerance = 0.02;
        private double deduplicationThreshold = 0.8;
        private int maxAskCandidates = 5;
        private MergeStrategy mergeStrategy = MergeStrategy.PRESERVE_MOST_COMPLETE;
        /** Sources in decreasing authority, used by PRESERVE_MOST_AUTHORITATIVE. */
        private List<String> sourceRanking = new ArrayList<>(List.of("graph"));

        public ConfidenceWeights weights() {
            return new ConfidenceWeights(nameWeight, typeWeight, propertyWeight, contextWeight);
        }

        public ResolutionSettings settings() {
            return new ResolutionSettings(useExistingThreshold, createNewThreshold, singleCandidateAcceptThreshold,
                    tieTolerance, deduplicationThreshold, maxAskCandidates, mergeStrategy);
        }
    }

    @Data
    public static class Context {
        private int maxAttempts = 3;
        private int historyWindow = 10;
    }

    @Data
    public static class Orchestration {
        private int maxRetries = 3;
        private int maxTransitions = 100;
        private int historyLimit = 200;
        private Duration escalationTimeout = Duration.ofHours(24);
        private Duration disambiguationTimeout = Duration.ofHours(24);
        private int maxEscalationOptions = 4;
        private int workerThreads = 4;
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Tools {
        private Duration timeout = Duration.ofSeconds(30);
        private int threads = 4;
    }

    @Data
    public static class Graph {
        private int contextDepth = 2;
        private int contextMaxNodes = 50;
        private int maxSubgraphDepth = 3;
        /** Per-label properties whose values must be unique, e.g. {@code Person: [email]}. */
        private Map<String, Set<String>> uniqueProperties = new HashMap<>();
    }

    @Data
    public static class Checkpoint {
        /** {@code memory} or {@code jdbc}. */
        private String store = "memory";
        private boolean initializeSchema = true;
    }
}
