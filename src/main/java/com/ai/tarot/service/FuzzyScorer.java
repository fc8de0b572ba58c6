package com.ai.tarot.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Weighted string similarity on a 0-100 scale. Combines a plain edit ratio with
 * partial (substring), token-sort and token-set ratios so that typos, missing words
 * and reordered words still score high.
 */
@Component
public class FuzzyScorer {

    private static final double TOKEN_SCALE = 0.95;
    private static final double PARTIAL_SCALE = 0.9;
    private static final double LONG_PARTIAL_SCALE = 0.6;

    public int score(String a, String b) {
        if (StringUtils.isEmpty(a) || StringUtils.isEmpty(b)) return 0;
        if (a.equals(b)) return 100;

        double base = ratio(a, b);
        double lengthRatio = (double) Math.max(a.length(), b.length()) / Math.min(a.length(), b.length());

        if (lengthRatio < 1.5) {
            double tokens = Math.max(tokenSortRatio(a, b), tokenSetRatio(a, b)) * TOKEN_SCALE;
            return (int) Math.round(Math.max(base, tokens));
        }

        double partialScale = lengthRatio < 8 ? PARTIAL_SCALE : LONG_PARTIAL_SCALE;
        double partial = partialRatio(a, b) * partialScale;
        double tokens = Math.max(tokenSortRatio(a, b), tokenSetRatio(a, b)) * TOKEN_SCALE * partialScale;
        return (int) Math.round(Math.max(base, Math.max(partial, tokens)));
    }

    /** Indel similarity: 100 * (1 - (insertions + deletions) / (|a| + |b|)). */
    double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 100;
        int lcs = longestCommonSubsequence(a, b);
        return 100.0 * (2.0 * lcs) / total;
    }

    double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        int window = shorter.length();
        double best = 0;
        for (int start = 0; start + window <= longer.length(); start++) {
            best = Math.max(best, ratio(shorter, longer.substring(start, start + window)));
            if (best == 100) break;
        }
        return best;
    }

    double tokenSortRatio(String a, String b) {
        return ratio(sortedTokens(a), sortedTokens(b));
    }

    double tokenSetRatio(String a, String b) {
        TreeSet<String> tokensA = new TreeSet<>(Arrays.asList(StringUtils.split(a)));
        TreeSet<String> tokensB = new TreeSet<>(Arrays.asList(StringUtils.split(b)));

        TreeSet<String> common = new TreeSet<>(tokensA);
        common.retainAll(tokensB);
        TreeSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        TreeSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        String intersection = String.join(" ", common);
        String combinedA = join(intersection, String.join(" ", onlyA));
        String combinedB = join(intersection, String.join(" ", onlyB));

        if (intersection.isEmpty()) {
            return ratio(combinedA, combinedB);
        }
        return Math.max(ratio(intersection, combinedA),
                Math.max(ratio(intersection, combinedB), ratio(combinedA, combinedB)));
    }

    private static String sortedTokens(String s) {
        List<String> tokens = new ArrayList<>(Arrays.asList(StringUtils.split(s)));
        tokens.sort(null);
        return String.join(" ", tokens);
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) return tail;
        if (tail.isEmpty()) return head;
        return head + " " + tail;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
