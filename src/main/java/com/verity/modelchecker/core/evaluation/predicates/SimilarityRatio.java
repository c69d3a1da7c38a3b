/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

/**
 * Normalised edit-distance similarity in [0, 1].
 *
 * The distance counts insertions and deletions only (a substitution costs two), so the
 * ratio is {@code 1 - distance / (len1 + len2)}, which equals
 * {@code 2 * lcs / (len1 + len2)} for the longest common subsequence {@code lcs}.
 * Two empty strings are fully similar.
 */
final class SimilarityRatio {

    private SimilarityRatio() {
    }

    static double ratio(String first, String second) {
        int total = first.length() + second.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(first, second) / total;
    }

    private static int longestCommonSubsequence(String first, String second) {
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int i = 1; i <= first.length(); i++) {
            char c = first.charAt(i - 1);
            for (int j = 1; j <= second.length(); j++) {
                if (c == second.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }
}
