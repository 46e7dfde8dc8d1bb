package com.eainde.graphagent.resolution;

import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityMention;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Log4j2
public class DefaultResolutionRules implements ResolutionRules {

    public static final Set<String> DEFAULT_UNIQUE_KEYS = Set.of("key", "username", "login", "identifier", "id", "email");

    private final Set<String> uniqueKeyProperties;
    private final double minNameEvidence;

    public DefaultResolutionRules() {
        this(DEFAULT_UNIQUE_KEYS, 0.3);
    }

    public DefaultResolutionRules(Set<String> uniqueKeyProperties, double minNameEvidence) {
        this.uniqueKeyProperties = Set.copyOf(uniqueKeyProperties);
        this.minNameEvidence = minNameEvidence;
    }

    @Override
    public Optional<RuleMatch> exactMatch(EntityMention mention, List<EntityCandidate> candidates) {
        String surface = mention.surfaceForm().trim();
        for (EntityCandidate candidate : candidates) {
            if (!typeCompatible(mention, candidate)) {
                continue;
            }
            if (mention.canonicalId() != null && mention.canonicalId().equals(candidate.id())) {
                return Optional.of(new RuleMatch(candidate, "canonical id"));
            }
            if (surface.equals(candidate.id())) {
                return Optional.of(new RuleMatch(candidate, "candidate id"));
            }
            if (candidate.key() != null && surface.equalsIgnoreCase(candidate.key().trim())) {
                return Optional.of(new RuleMatch(candidate, "natural key"));
            }
            for (String property : uniqueKeyProperties) {
                Object value = candidate.properties().get(property);
                if (value != null && surface.equalsIgnoreCase(value.toString().trim())) {
                    return Optional.of(new RuleMatch(candidate, "unique property " + property));
                }
                Object given = mention.properties().get(property);
                if (value != null && given != null && given.toString().equalsIgnoreCase(value.toString())) {
                    return Optional.of(new RuleMatch(candidate, "unique property " + property));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public List<EntityCandidate> matchCandidates(EntityMention mention, List<EntityCandidate> candidates) {
        List<EntityCandidate> viable = candidates.stream()
                .filter(c -> typeCompatible(mention, c))
                .filter(c -> hasNameEvidence(mention, c) || hasPropertyEvidence(mention, c))
                .toList();
        log.debug("Rules kept {} of {} candidates for '{}'", viable.size(), candidates.size(), mention.surfaceForm());
        return viable;
    }

    private static boolean typeCompatible(EntityMention mention, EntityCandidate candidate) {
        return mention.typeHint() == null || mention.typeHint().isBlank()
                || mention.typeHint().equalsIgnoreCase(candidate.label());
    }

    private boolean hasNameEvidence(EntityMention mention, EntityCandidate candidate) {
        double byName = StringSimilarity.nameSimilarity(mention.surfaceForm(), candidate.name());
        double byKey = StringSimilarity.nameSimilarity(mention.surfaceForm(), candidate.key());
        return Math.max(byName, byKey) >= minNameEvidence;
    }

    private static boolean hasPropertyEvidence(EntityMention mention, EntityCandidate candidate) {
        for (Map.Entry<String, Object> entry : mention.properties().entrySet()) {
            Object value = candidate.properties().get(entry.getKey());
            if (value != null && entry.getValue() != null
                    && value.toString().equalsIgnoreCase(entry.getValue().toString())) {
                return true;
            }
        }
        return false;
    }
}
