package com.leakgate.classify;

import java.util.HashMap;
import java.util.Map;

final class EntropyHeuristics {

    private EntropyHeuristics() {
    }

    /** Shannon entropy in bits per character. */
    static double shannonEntropy(String s) {
        if (s == null || s.isEmpty()) return 0.0;
        Map<Character, Integer> frequency = new HashMap<>();
        for (char c : s.toCharArray()) {
            frequency.merge(c, 1, Integer::sum);
        }
        double entropy = 0.0;
        for (int count : frequency.values()) {
            double p = (double) count / s.length();
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /** True when the text holds a run of at least five consecutive ascending characters (abcde, 12345). */
    static boolean hasAscendingRun(String s) {
        if (s == null || s.length() < 6) return false;
        int steps = 0;
        for (int i = 0; i < s.length() - 1; i++) {
            if (s.charAt(i + 1) == s.charAt(i) + 1) {
                steps++;
                if (steps >= 4) return true;
            } else {
                steps = 0;
            }
        }
        return false;
    }

    static int distinctChars(String s) {
        return (int) s.chars().distinct().count();
    }
}
