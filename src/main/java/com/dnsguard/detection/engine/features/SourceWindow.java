package com.dnsguard.detection.engine.features;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Trailing history of one source's queries. Not thread-safe: the owning
 * {@link WindowedFeatureExtractor} serialises access per source key.
 */
class SourceWindow {

    private final Deque<Entry> entries = new ArrayDeque<>();
    private long newestObservedAt = Long.MIN_VALUE;

    void append(String subject, long observedAt, double entropy) {
        entries.addLast(new Entry(subject, observedAt, entropy));
        newestObservedAt = Math.max(newestObservedAt, observedAt);
    }

    /** Drops every entry observed strictly before {@code cutoff}. */
    void evictOlderThan(long cutoff) {
        entries.removeIf(e -> e.observedAt < cutoff);
    }

    boolean isIdleAt(long cutoff) {
        return entries.isEmpty() || newestObservedAt < cutoff;
    }

    int size() {
        return entries.size();
    }

    WindowStats stats() {
        if (entries.isEmpty()) {
            return new WindowStats(0.0, 0, 0.0, 0.0);
        }

        long first = Long.MAX_VALUE;
        long last = Long.MIN_VALUE;
        double entropySum = 0.0;
        double entropyMax = Double.NEGATIVE_INFINITY;
        Set<String> subjects = new HashSet<>();

        for (Entry e : entries) {
            first = Math.min(first, e.observedAt);
            last = Math.max(last, e.observedAt);
            entropySum += e.entropy;
            entropyMax = Math.max(entropyMax, e.entropy);
            subjects.add(e.subject);
        }

        double qps;
        if (entries.size() > 1) {
            double spanSeconds = (last - first) / 1000.0;
            qps = entries.size() / Math.max(spanSeconds, 1.0);
        } else {
            qps = 1.0;
        }

        return new WindowStats(qps, subjects.size(), entropySum / entries.size(), entropyMax);
    }

    private record Entry(String subject, long observedAt, double entropy) {}

    record WindowStats(double queriesPerSecond, int uniqueSubjects, double meanEntropy, double maxEntropy) {}
}
