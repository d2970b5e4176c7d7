package com.dnsguard.detection.engine.features;

import java.util.HashMap;
import java.util.Map;

/**
 * Stateless features computed from the query name alone.
 *
 * Features:
 *   length                 character count
 *   entropy                Shannon entropy (bits) of the character distribution
 *   label count            '.'-separated segments, i.e. dots + 1
 *   max label length       longest segment
 *   digit ratio            decimal digits / length
 *   non-alphanumeric ratio characters that are neither alphanumeric nor '.' / length
 */
public final class QueryFeatures {

    private static final double LN_2 = Math.log(2.0);

    private QueryFeatures() {}

    public static int length(String subject) {
        return subject.length();
    }

    public static double entropy(String subject) {
        if (subject.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < subject.length(); i++) {
            counts.merge(subject.charAt(i), 1, Integer::sum);
        }

        double total = subject.length();
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / total;
            entropy -= p * (Math.log(p) / LN_2);
        }
        return entropy;
    }

    public static int labelCount(String subject) {
        int dots = 0;
        for (int i = 0; i < subject.length(); i++) {
            if (subject.charAt(i) == '.') dots++;
        }
        return dots + 1;
    }

    public static int maxLabelLength(String subject) {
        int max = 0;
        int current = 0;
        for (int i = 0; i < subject.length(); i++) {
            if (subject.charAt(i) == '.') {
                max = Math.max(max, current);
                current = 0;
            } else {
                current++;
            }
        }
        return Math.max(max, current);
    }

    public static double digitRatio(String subject) {
        if (subject.isEmpty()) {
            return 0.0;
        }
        long digits = subject.chars().filter(Character::isDigit).count();
        return (double) digits / subject.length();
    }

    public static double nonAlphanumericRatio(String subject) {
        if (subject.isEmpty()) {
            return 0.0;
        }
        long other = subject.chars()
                .filter(c -> !Character.isLetterOrDigit(c) && c != '.')
                .count();
        return (double) other / subject.length();
    }
}
