package com.eainde.graphagent.resolution;

import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityConfidence;
import com.eainde.graphagent.model.EntityMention;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.ResolutionStrategy;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves mentions against a {@link GraphSnapshot}.
 *
 * <ol>
 * <li>Exact rule match short-circuits to {@code USE_EXISTING} with full confidence.</li>
 * <li>Remaining candidates are pruned by the rules and scored.</li>
 * <li>Candidates tied with the best one are deduplicated and merged.</li>
 * <li>The best score decides: above {@code useExistingThreshold} use it, below
 * {@code createNewThreshold} create, in between ask, unless a lone candidate
 * reaches {@code singleCandidateAcceptThreshold}.</li>
 * </ol>
 */
@Log4j2
public class GraphAwareEntityResolver implements EntityResolver {

    private final SimilarityScorer scorer;
    private final ResolutionRules rules;
    private final DeduplicationEngine deduplicationEngine;
    private final ResolutionSettings settings;
    private final Clock clock;

    public GraphAwareEntityResolver(SimilarityScorer scorer, ResolutionRules rules,
                                    DeduplicationEngine deduplicationEngine, ResolutionSettings settings, Clock clock) {
        this.scorer = scorer;
        this.rules = rules;
        this.deduplicationEngine = deduplicationEngine;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public EntityResolution resolve(EntityMention mention, GraphSnapshot snapshot) {
        if (mention == null || mention.surfaceForm() == null || mention.surfaceForm().isBlank()) {
            throw new ValidationException("Entity mention must not be empty");
        }
        GraphSnapshot context = snapshot != null ? snapshot : GraphSnapshot.empty("none");

        List<EntityCandidate> candidates = new ArrayList<>(mention.candidates());
        context.nodes().stream()
                .map(EntityCandidate::fromNode)
                .filter(c -> candidates.stream().noneMatch(existing -> existing.id().equals(c.id())))
                .forEach(candidates::add);
        if (candidates.isEmpty()) {
            return createNew(mention, EntityConfidence.none(), "No entities in the graph context; creating a new entity");
        }

        Optional<RuleMatch> exact = rules.exactMatch(mention, candidates);
        if (exact.isPresent()) {
            EntityCandidate match = exact.get().candidate().withSimilarity(1.0);
            log.debug("Exact match for '{}' via {}", mention.surfaceForm(), exact.get().rule());
            return useExisting(mention, match, EntityConfidence.exact(), List.of(match),
                    "Exact match on " + exact.get().rule());
        }

        List<EntityCandidate> viable = rules.matchCandidates(mention, candidates);
        if (viable.isEmpty()) {
            return createNew(mention, EntityConfidence.none(), "No candidate shares name or property evidence");
        }

        List<Scored> scored = new ArrayList<>();
        for (EntityCandidate candidate : viable) {
            EntityConfidence confidence = scorer.score(mention, candidate, context);
            scored.add(new Scored(candidate.withSimilarity(confidence.overall()), confidence));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> s.confidence().overall()).reversed());
        scored = mergeTiedDuplicates(scored);

        return decide(mention, scored);
    }

    @Override
    public ResolvedGoalSpec resolveAll(IntentSpec intent, GraphSnapshot snapshot) {
        List<EntityResolution> resolutions = new ArrayList<>();
        List<String> mentions = intent.mentions();
        for (int i = 0; i < mentions.size(); i++) {
            String surface = mentions.get(i);
            List<String> coMentions = mentions.stream().filter(m -> !m.equals(surface)).toList();
            boolean primary = i == 0;
            EntityMention mention = new EntityMention(surface, null, List.of(),
                    primary ? intent.entityType() : null,
                    primary ? intent.literalProperties() : Map.of(),
                    coMentions);
            resolutions.add(resolve(mention, snapshot));
        }
        ResolvedGoalSpec resolved = ResolvedGoalSpec.of(intent, resolutions);
        log.info("Resolved {} mentions, {} pending ambiguities", resolutions.size(),
                resolved.pendingAmbiguities().size());
        return resolved;
    }

    @Override
    public EntityResolution choose(EntityResolution previous, String candidateId) {
        EntityCandidate chosen = previous.candidates().stream()
                .filter(c -> c.id().equals(candidateId) || c.mergedFrom().contains(candidateId))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Candidate " + candidateId
                        + " was not offered for '" + previous.mention() + "'"));
        return new EntityResolution(UUID.randomUUID().toString(), previous.mention(), ResolutionStrategy.USE_EXISTING,
                chosen.id(), chosen.key(), chosen.label(), previous.confidence(), List.of(chosen),
                "Chosen by user", previous.resolutionId(), clock.instant());
    }

    @Override
    public EntityResolution createNew(EntityResolution previous) {
        return new EntityResolution(UUID.randomUUID().toString(), previous.mention(), ResolutionStrategy.CREATE_NEW,
                null, null, null, previous.confidence(), List.of(),
                "User asked for a new entity", previous.resolutionId(), clock.instant());
    }

    private EntityResolution decide(EntityMention mention, List<Scored> scored) {
        Scored best = scored.get(0);
        double overall = best.confidence().overall();
        String score = String.format(Locale.ROOT, "%.2f", overall);

        if (overall > settings.useExistingThreshold()) {
            return useExisting(mention, best.candidate(), best.confidence(), List.of(best.candidate()),
                    "High confidence match (" + score + ")");
        }
        if (overall < settings.createNewThreshold()) {
            return createNew(mention, best.confidence(), "Best match too weak (" + score + ")");
        }

        List<EntityCandidate> inBand = scored.stream()
                .filter(s -> s.confidence().overall() >= settings.createNewThreshold())
                .map(Scored::candidate)
                .toList();
        if (inBand.size() == 1 && overall >= settings.singleCandidateAcceptThreshold()) {
            return useExisting(mention, best.candidate(), best.confidence(), inBand,
                    "Single plausible candidate (" + score + ")");
        }

        List<EntityCandidate> offered = inBand.stream().limit(settings.maxAskCandidates()).toList();
        log.info("Mention '{}' is ambiguous between {} candidates", mention.surfaceForm(), offered.size());
        return new EntityResolution(UUID.randomUUID().toString(), mention.surfaceForm(), ResolutionStrategy.ASK_USER,
                null, null, null, best.confidence(), offered,
                offered.size() + " plausible candidates, best " + score, null, clock.instant());
    }

    private List<Scored> mergeTiedDuplicates(List<Scored> scored) {
        double best = scored.get(0).confidence().overall();
        List<Scored> tied = scored.stream()
                .filter(s -> best - s.confidence().overall() <= settings.tieTolerance())
                .toList();
        if (tied.size() < 2) {
            return scored;
        }
        List<List<EntityCandidate>> clusters = deduplicationEngine.findDuplicates(
                tied.stream().map(Scored::candidate).toList(), settings.deduplicationThreshold());
        if (clusters.isEmpty()) {
            return scored;
        }

        List<Scored> merged = new ArrayList<>(scored);
        for (List<EntityCandidate> cluster : clusters) {
            List<String> ids = cluster.stream().map(EntityCandidate::id).toList();
            Scored strongest = merged.stream().filter(s -> ids.contains(s.candidate().id())).findFirst().orElseThrow();
            merged.removeIf(s -> ids.contains(s.candidate().id()));
            EntityCandidate folded = deduplicationEngine.merge(cluster, settings.mergeStrategy())
                    .withSimilarity(strongest.confidence().overall());
            merged.add(new Scored(folded, strongest.confidence()));
        }
        merged.sort(Comparator.comparingDouble((Scored s) -> s.confidence().overall()).reversed());
        return merged;
    }

    private EntityResolution useExisting(EntityMention mention, EntityCandidate candidate, EntityConfidence confidence,
                                         List<EntityCandidate> candidates, String reasoning) {
        return new EntityResolution(UUID.randomUUID().toString(), mention.surfaceForm(), ResolutionStrategy.USE_EXISTING,
                candidate.id(), candidate.key(), candidate.label(), confidence, candidates, reasoning, null,
                clock.instant());
    }

    private EntityResolution createNew(EntityMention mention, EntityConfidence confidence, String reasoning) {
        return new EntityResolution(UUID.randomUUID().toString(), mention.surfaceForm(), ResolutionStrategy.CREATE_NEW,
                null, null, null, confidence, List.of(), reasoning, null, clock.instant());
    }

    private record Scored(EntityCandidate candidate, EntityConfidence confidence) {
    }
}
