package com.dnsguard.detection.engine.features;

import com.dnsguard.detection.config.DetectionConfig;
import com.dnsguard.detection.model.Feature;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns a DNS query into a {@link FeatureVector}: six features from the query name plus four
 * aggregated over the source's trailing window.
 *
 * Each call runs inside {@link ConcurrentMap#compute} for its source key, so the
 * append, evict and read sequence is atomic per source while different sources proceed
 * in parallel.
 */
@Component
public class WindowedFeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(WindowedFeatureExtractor.class);

    private final long windowMillis;
    private final Clock clock;
    private final ConcurrentMap<String, SourceWindow> windows = new ConcurrentHashMap<>();

    @Autowired
    public WindowedFeatureExtractor(DetectionConfig config, Clock clock) {
        this(config.getWindowSeconds() * 1000L, clock);
    }

    public WindowedFeatureExtractor(long windowMillis, Clock clock) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window span must be positive, got " + windowMillis + "ms");
        }
        this.windowMillis = windowMillis;
        this.clock = clock;
    }

    public FeatureVector extract(String subject, String sourceKey) {
        return extract(subject, sourceKey, clock.millis());
    }

    public FeatureVector extract(String subject, String sourceKey, long observedAt) {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("sourceKey is required");
        }
        String query = subject == null ? "" : subject;

        double[] values = new double[Feature.COUNT];
        double entropy = QueryFeatures.entropy(query);
        values[Feature.LENGTH.ordinal()] = QueryFeatures.length(query);
        values[Feature.ENTROPY.ordinal()] = entropy;
        values[Feature.LABEL_COUNT.ordinal()] = QueryFeatures.labelCount(query);
        values[Feature.MAX_LABEL_LENGTH.ordinal()] = QueryFeatures.maxLabelLength(query);
        values[Feature.DIGIT_RATIO.ordinal()] = QueryFeatures.digitRatio(query);
        values[Feature.NON_ALPHANUMERIC_RATIO.ordinal()] = QueryFeatures.nonAlphanumericRatio(query);

        windows.compute(sourceKey, (key, window) -> {
            SourceWindow w = window != null ? window : new SourceWindow();
            w.append(query, observedAt, entropy);
            w.evictOlderThan(observedAt - windowMillis);

            SourceWindow.WindowStats stats = w.stats();
            values[Feature.QUERY_RATE.ordinal()] = stats.queriesPerSecond();
            values[Feature.UNIQUE_SUBJECTS.ordinal()] = stats.uniqueSubjects();
            values[Feature.MEAN_ENTROPY.ordinal()] = stats.meanEntropy();
            values[Feature.MAX_ENTROPY.ordinal()] = stats.maxEntropy();
            return w;
        });

        return FeatureVector.of(values);
    }

    public FeatureVector extract(QueryRecord record) {
        Long observedAt = record.getObservedAt();
        return extract(record.getSubject(), record.getSourceKey(),
                observedAt != null ? observedAt : clock.millis());
    }

    /** Extracts in list order; every record still passes through its source window. */
    public List<FeatureVector> extractBatch(List<QueryRecord> records) {
        List<FeatureVector> vectors = new ArrayList<>(records.size());
        for (QueryRecord record : records) {
            vectors.add(extract(record));
        }
        return vectors;
    }

    /**
     * Removes windows whose newest entry fell out of the span before {@code now}.
     *
     * @return number of windows removed
     */
    public int evictIdleSources(long now) {
        long cutoff = now - windowMillis;
        int[] removed = new int[1];
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, w) -> {
                if (w.isIdleAt(cutoff)) {
                    removed[0]++;
                    return null;
                }
                return w;
            });
        }
        if (removed[0] > 0) {
            log.debug("Evicted {} idle source windows, {} remain", removed[0], windows.size());
        }
        return removed[0];
    }

    public int sourceCount() {
        return windows.size();
    }

    /** Entries currently retained for {@code sourceKey}; 0 if the source is unknown. */
    public int windowSize(String sourceKey) {
        int[] size = new int[1];
        windows.computeIfPresent(sourceKey, (k, w) -> {
            size[0] = w.size();
            return w;
        });
        return size[0];
    }

    public long getWindowMillis() {
        return windowMillis;
    }
}
