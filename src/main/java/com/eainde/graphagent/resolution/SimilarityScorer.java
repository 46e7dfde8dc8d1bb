package com.eainde.graphagent.resolution;

import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.graph.Node;
import com.eainde.graphagent.model.ConfidenceWeights;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityConfidence;
import com.eainde.graphagent.model.EntityMention;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a mention against a candidate along four dimensions and combines them
 * with the configured {@link ConfidenceWeights}.
 *
 * <ul>
 * <li><b>name</b>: {@link StringSimilarity#nameSimilarity} against name and key, best of both.</li>
 * <li><b>type</b>: 1.0/0.0 against an explicit type hint; 0.8 for a labelled candidate otherwise, 0.5 if unlabelled.</li>
 * <li><b>property</b>: share of the mention's properties (given or read from the text) the candidate agrees with;
 * 0.5 when the mention carries none, 0.0 when the candidate has none.</li>
 * <li><b>context</b>: share of co-mentions found among the candidate's neighbours; 0.5 without co-mentions.</li>
 * </ul>
 */
public class SimilarityScorer {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+\\.[\\w.]+");
    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Z]+-\\d+\\b");

    private final ConfidenceWeights weights;

    public SimilarityScorer(ConfidenceWeights weights) {
        this.weights = weights;
    }

    public ConfidenceWeights weights() {
        return weights;
    }

    public EntityConfidence score(EntityMention mention, EntityCandidate candidate, GraphSnapshot snapshot) {
        return EntityConfidence.of(
                nameMatch(mention, candidate),
                typeMatch(mention, candidate),
                propertyMatch(mention, candidate),
                contextMatch(mention, candidate, snapshot),
                weights);
    }

    double nameMatch(EntityMention mention, EntityCandidate candidate) {
        return Math.max(
                StringSimilarity.nameSimilarity(mention.surfaceForm(), candidate.name()),
                StringSimilarity.nameSimilarity(mention.surfaceForm(), candidate.key()));
    }

    double typeMatch(EntityMention mention, EntityCandidate candidate) {
        if (mention.typeHint() != null && !mention.typeHint().isBlank()) {
            return mention.typeHint().equalsIgnoreCase(candidate.label()) ? 1.0 : 0.0;
        }
        return candidate.label() != null && !candidate.label().isBlank() ? 0.8 : 0.5;
    }

    double propertyMatch(EntityMention mention, EntityCandidate candidate) {
        if (candidate.properties().isEmpty()) {
            return 0.0;
        }
        List<Evidence> evidence = extractEvidence(mention);
        if (evidence.isEmpty()) {
            return 0.5;
        }
        int matched = 0;
        for (Evidence item : evidence) {
            String value = item.value();
            if (item.key() != null) {
                Object actual = candidate.properties().get(item.key());
                if (actual != null && actual.toString().equalsIgnoreCase(value)) {
                    matched++;
                }
            } else if (candidate.properties().values().stream()
                    .anyMatch(v -> v != null && v.toString().equalsIgnoreCase(value))) {
                matched++;
            }
        }
        return (double) matched / evidence.size();
    }

    double contextMatch(EntityMention mention, EntityCandidate candidate, GraphSnapshot snapshot) {
        if (mention.coMentions().isEmpty() || snapshot == null) {
            return 0.5;
        }
        List<Node> neighbors = snapshot.neighbors(candidate.id());
        int found = 0;
        for (String coMention : mention.coMentions()) {
            boolean adjacent = neighbors.stream().anyMatch(n ->
                    StringSimilarity.nameSimilarity(coMention, n.name()) >= 0.8
                            || StringSimilarity.nameSimilarity(coMention, n.key()) >= 0.8);
            if (adjacent) {
                found++;
            }
        }
        return (double) found / mention.coMentions().size();
    }

    private static List<Evidence> extractEvidence(EntityMention mention) {
        List<Evidence> evidence = new ArrayList<>();
        for (Map.Entry<String, Object> entry : mention.properties().entrySet()) {
            if (entry.getValue() != null) {
                evidence.add(new Evidence(entry.getKey(), entry.getValue().toString()));
            }
        }
        Matcher email = EMAIL.matcher(mention.surfaceForm());
        while (email.find()) {
            evidence.add(new Evidence(null, email.group()));
        }
        Matcher identifier = IDENTIFIER.matcher(mention.surfaceForm());
        while (identifier.find()) {
            evidence.add(new Evidence(null, identifier.group()));
        }
        return evidence;
    }

    /** A property value the mention asserts; {@code key} is null when read from free text. */
    private record Evidence(String key, String value) {
    }
}
