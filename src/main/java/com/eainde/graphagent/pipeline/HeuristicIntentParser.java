package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.model.GoalComplexity;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.IntentType;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based parser, used when no chat model is configured and
 * as the fallback of {@link LlmIntentParser}.
 *
 * <pre>
 * Create 'Alice' of type 'Person' with email=alice@example.com and link it to 'Acme' as 'WORKS_AT'
 * </pre>
 * yields intent CREATE, mentions [Alice, Acme], type Person, property email and
 * relationship WORKS_AT to Acme.
 */
@Log4j2
public class HeuristicIntentParser implements IntentParser {

    private static final Pattern TYPE = Pattern.compile(
            "\\b(?:of\\s+)?type\\s+(?:'([^']+)'|\"([^\"]+)\"|(\\w+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIONSHIP = Pattern.compile(
            "\\blink(?:ed)?\\s+(?:it\\s+)?to\\s+(?:'([^']+)'|\"([^\"]+)\")\\s+as\\s+(?:'([^']+)'|\"([^\"]+)\"|(\\w+))",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern KEY_VALUE = Pattern.compile(
            "\\b(\\w+)\\s*=\\s*(?:'([^']*)'|\"([^\"]*)\"|([^\\s,;]+))");
    private static final Pattern QUOTED = Pattern.compile("'([^']+)'|\"([^\"]+)\"");
    private static final Pattern NAMED = Pattern.compile("\\b(?:called|named)\\s+(\\p{Lu}[\\w-]*(?:\\s+\\p{Lu}[\\w-]*)*)");
    private static final Pattern CAPITALIZED = Pattern.compile("\\b(\\p{Lu}[\\w-]*(?:\\s+\\p{Lu}[\\w-]*)*)");
    private static final Pattern MULTI_STEP = Pattern.compile("\\bthen\\b|;", Pattern.CASE_INSENSITIVE);

    private static final Map<IntentType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(IntentType.CREATE, List.of("create", "add", "new", "make", "register", "insert"));
        KEYWORDS.put(IntentType.UPDATE, List.of("update", "set", "change", "rename", "modify", "edit"));
        KEYWORDS.put(IntentType.DELETE, List.of("delete", "remove", "drop", "unlink"));
        KEYWORDS.put(IntentType.QUERY, List.of("find", "show", "list", "get", "query", "search", "who", "what", "which"));
    }

    @Override
    public IntentSpec parse(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new ValidationException("Goal must not be empty");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        String remaining = goal;

        Matcher relationship = RELATIONSHIP.matcher(remaining);
        String relationshipTarget = null;
        if (relationship.find()) {
            relationshipTarget = first(relationship, 1, 2);
            attributes.put(IntentSpec.RELATIONSHIP_TARGET, relationshipTarget);
            attributes.put(IntentSpec.RELATIONSHIP, first(relationship, 3, 4, 5));
            remaining = remaining.substring(0, relationship.start()) + " " + remaining.substring(relationship.end());
        }

        Matcher type = TYPE.matcher(remaining);
        if (type.find()) {
            attributes.put(IntentSpec.TYPE, first(type, 1, 2, 3));
            remaining = remaining.substring(0, type.start()) + " " + remaining.substring(type.end());
        }

        Matcher keyValue = KEY_VALUE.matcher(remaining);
        StringBuilder withoutPairs = new StringBuilder();
        while (keyValue.find()) {
            String value = first(keyValue, 2, 3, 4);
            attributes.putIfAbsent(keyValue.group(1), value == null ? "" : value);
            keyValue.appendReplacement(withoutPairs, " ");
        }
        keyValue.appendTail(withoutPairs);
        remaining = withoutPairs.toString();

        Set<String> mentions = new LinkedHashSet<>(quoted(remaining));
        if (mentions.isEmpty()) {
            mentions.addAll(unquoted(remaining));
        }
        if (relationshipTarget != null) {
            mentions.add(relationshipTarget);
        }

        IntentType intentType = intentType(goal);
        GoalComplexity complexity = complexity(goal, mentions.size(), relationshipTarget != null);
        IntentSpec intent = new IntentSpec(goal, intentType, new ArrayList<>(mentions), complexity,
                !mentions.isEmpty(), attributes);
        log.debug("Parsed goal heuristically: {} {} {}", intentType, mentions, attributes);
        return intent;
    }

    static IntentType intentType(String goal) {
        String[] words = goal.toLowerCase(Locale.ROOT).split("[^\\p{L}]+");
        for (String word : words) {
            for (Map.Entry<IntentType, List<String>> entry : KEYWORDS.entrySet()) {
                if (entry.getValue().contains(word)) {
                    return entry.getKey();
                }
            }
        }
        return IntentType.UNKNOWN;
    }

    private static GoalComplexity complexity(String goal, int mentionCount, boolean hasRelationship) {
        if (MULTI_STEP.matcher(goal).find()) {
            return GoalComplexity.COMPLEX;
        }
        if (hasRelationship || mentionCount > 2) {
            return GoalComplexity.MODERATE;
        }
        return GoalComplexity.SIMPLE;
    }

    private static List<String> quoted(String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            String value = first(matcher, 1, 2).trim();
            if (!value.isEmpty()) {
                found.add(value);
            }
        }
        return found;
    }

    private static List<String> unquoted(String text) {
        List<String> found = new ArrayList<>();
        Matcher named = NAMED.matcher(text);
        while (named.find()) {
            found.add(named.group(1).trim());
        }
        if (!found.isEmpty()) {
            return found;
        }
        Matcher capitalized = CAPITALIZED.matcher(text);
        while (capitalized.find()) {
            // the first word of a sentence is capitalized anyway
            if (capitalized.start() == firstWordStart(text)) {
                String rest = capitalized.group(1).replaceFirst("^\\S+\\s*", "");
                if (!rest.isEmpty()) {
                    found.add(rest);
                }
                continue;
            }
            found.add(capitalized.group(1).trim());
        }
        return found;
    }

    private static int firstWordStart(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return 0;
    }

    private static String first(Matcher matcher, int... groups) {
        for (int group : groups) {
            if (matcher.group(group) != null) {
                return matcher.group(group);
            }
        }
        return null;
    }
}
