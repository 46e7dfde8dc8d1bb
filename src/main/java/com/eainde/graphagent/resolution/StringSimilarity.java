package com.eainde.graphagent.resolution;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ratcliff/Obershelp string similarity and the normalization applied before comparing names.
 */
public final class StringSimilarity {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private StringSimilarity() {
    }

    /** Lower-cases, strips punctuation and collapses whitespace. */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String stripped = PUNCTUATION.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * {@code 2 * M / T}, where {@code M} is the number of characters in the
     * recursively found longest common blocks and {@code T} the combined length.
     * Two empty strings are identical.
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    /**
     * Name similarity on normalized input: exact match scores 1.0, containment
     * of one in the other scores at least 0.8.
     */
    public static double nameSimilarity(String mention, String candidate) {
        String m = normalize(mention);
        String c = normalize(candidate);
        if (m.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (m.equals(c)) {
            return 1.0;
        }
        double similarity = ratio(m, c);
        if (m.contains(c) || c.contains(m)) {
            similarity = Math.max(similarity, 0.8);
        }
        return similarity;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLo] + 1;
                    current[j - bLo + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
