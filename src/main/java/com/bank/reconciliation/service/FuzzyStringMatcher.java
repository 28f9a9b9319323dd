package com.bank.reconciliation.service;

import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.TreeSet;

/**
 * Edit-distance based string similarity on a 0-100 scale.
 *
 * {@link #ratio} is the indel similarity {@code 2 * LCS / (|a| + |b|)}. {@link #weightedRatio}
 * additionally considers token-set overlap and best-window alignment, so that a vendor name
 * extended with a branch or location ("KFC Johar" vs "KFC Johar Town") still scores high.
 */
@Component
public class FuzzyStringMatcher {

    private static final double TOKEN_SCALE = 0.95;
    private static final double PARTIAL_MIN_LENGTH_RATIO = 1.5;
    private static final double PARTIAL_LONG_LENGTH_RATIO = 8.0;

    private final LongestCommonSubsequence lcs = new LongestCommonSubsequence();

    public double ratio(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 100.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = lcs.apply(a, b);
        return 200.0 * common / (a.length() + b.length());
    }

    /**
     * Best ratio of the shorter string against every equally long window of the longer one.
     */
    public double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        if (shorter.isEmpty()) {
            return 0.0;
        }
        double best = 0.0;
        for (int start = 0; start + shorter.length() <= longer.length(); start++) {
            String window = longer.substring(start, start + shorter.length());
            best = Math.max(best, ratio(shorter, window));
            if (best >= 100.0) {
                break;
            }
        }
        return best;
    }

    /**
     * Compares the sorted common tokens against each side's full sorted token set.
     */
    public double tokenSetRatio(String a, String b) {
        TreeSet<String> tokensA = tokens(a);
        TreeSet<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> common = new TreeSet<>(tokensA);
        common.retainAll(tokensB);
        TreeSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        TreeSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        String base = String.join(" ", common);
        String combinedA = join(base, String.join(" ", onlyA));
        String combinedB = join(base, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!base.isEmpty()) {
            best = Math.max(best, ratio(base, combinedA));
            best = Math.max(best, ratio(base, combinedB));
        }
        return best;
    }

    public double weightedRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 100.0;
        }

        double best = Math.max(ratio(a, b), TOKEN_SCALE * tokenSetRatio(a, b));

        double lengthRatio = (double) Math.max(a.length(), b.length()) / Math.min(a.length(), b.length());
        if (lengthRatio >= PARTIAL_MIN_LENGTH_RATIO) {
            double partialScale = lengthRatio < PARTIAL_LONG_LENGTH_RATIO ? 0.9 : 0.6;
            best = Math.max(best, partialScale * partialRatio(a, b));
        }
        return Math.min(100.0, best);
    }

    private static TreeSet<String> tokens(String text) {
        TreeSet<String> tokens = new TreeSet<>();
        Arrays.stream(text.trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .forEach(tokens::add);
        return tokens;
    }

    private static String join(String base, String rest) {
        if (base.isEmpty()) return rest;
        if (rest.isEmpty()) return base;
        return base + " " + rest;
    }
}
