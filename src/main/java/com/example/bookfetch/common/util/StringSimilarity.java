package com.example.bookfetch.common.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Dice coefficient over character bigrams, whitespace ignored. 1.0 means identical.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static double compare(String first, String second) {
        String a = first == null ? "" : first.replaceAll("\\s+", "");
        String b = second == null ? "" : second.replaceAll("\\s+", "");
        if (a.equals(b)) {
            return a.isEmpty() ? 0D : 1D;
        }
        if (a.length() < 2 || b.length() < 2) {
            return 0D;
        }
        Map<String, Integer> firstBigrams = new HashMap<>();
        for (int i = 0; i < a.length() - 1; i++) {
            firstBigrams.merge(a.substring(i, i + 2), 1, Integer::sum);
        }
        int intersection = 0;
        for (int i = 0; i < b.length() - 1; i++) {
            String bigram = b.substring(i, i + 2);
            Integer count = firstBigrams.get(bigram);
            if (count != null && count > 0) {
                firstBigrams.put(bigram, count - 1);
                intersection++;
            }
        }
        return (2.0D * intersection) / (a.length() + b.length() - 2);
    }
}
