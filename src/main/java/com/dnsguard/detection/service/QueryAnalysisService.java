package com.dnsguard.detection.service;

import com.dnsguard.detection.config.DetectionConfig;
import com.dnsguard.detection.config.MetricsConfig;
import com.dnsguard.detection.engine.features.WindowedFeatureExtractor;
import com.dnsguard.detection.engine.scoring.AnomalyScorer;
import com.dnsguard.detection.engine.scoring.ModelUnavailableException;
import com.dnsguard.detection.engine.thresholds.AdaptiveThresholdController;
import com.dnsguard.detection.model.AnalysisResult;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.QueryRecord;
import com.dnsguard.detection.model.ScoreMode;
import com.dnsguard.detection.model.ScoringResult;
import com.dnsguard.detection.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Main orchestrator for query analysis.
 *
 * Flow:
 * 1. Extract per-query and per-source window features
 * 2. Score the feature vector and classify it under the live thresholds
 * 3. Record the (score, severity) pair with the adaptive threshold controller
 * 4. Return the result
 */
@Service
public class QueryAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalysisService.class);

    private final WindowedFeatureExtractor featureExtractor;
    private final AnomalyScorer scorer;
    private final AdaptiveThresholdController thresholdController;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public QueryAnalysisService(WindowedFeatureExtractor featureExtractor,
                                AnomalyScorer scorer,
                                AdaptiveThresholdController thresholdController,
                                DetectionConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.featureExtractor = featureExtractor;
        this.scorer = scorer;
        this.thresholdController = thresholdController;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @throws ModelUnavailableException if no model is loaded and the unscored policy is REJECT
     * @throws IllegalArgumentException  if the record has no source key
     */
    @Observed(name = "dns.analyze", contextualName = "analyze-query")
    public AnalysisResult analyze(QueryRecord record) {
        if (record == null || isBlank(record.getSourceKey())) {
            throw new IllegalArgumentException("sourceKey is required");
        }
        rejectIfNoModel();
        return analyzeRecord(record);
    }

    /**
     * Analyses the records in order. Every record is validated before the first one touches a
     * source window, so a rejected batch changes nothing.
     */
    @Observed(name = "dns.analyze_batch", contextualName = "analyze-batch")
    public List<AnalysisResult> analyzeBatch(List<QueryRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            QueryRecord record = records.get(i);
            if (record == null) {
                throw new IllegalArgumentException("Query at index " + i + " is null");
            }
            if (isBlank(record.getSourceKey())) {
                throw new IllegalArgumentException("sourceKey is required (query at index " + i + ")");
            }
        }
        rejectIfNoModel();

        List<AnalysisResult> results = new ArrayList<>(records.size());
        for (QueryRecord record : records) {
            results.add(analyzeRecord(record));
        }
        log.info("Analysed batch of {} queries ({} alerts)", results.size(),
                results.stream().filter(r -> r.getSeverity().isAlert()).count());
        return results;
    }

    @Scheduled(fixedRateString = "${detection.idle-sweep-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "60")
    public void sweepIdleSources() {
        int removed = featureExtractor.evictIdleSources(clock.millis());
        metricsConfig.updateActiveSourceCount(featureExtractor.sourceCount());
        if (removed > 0) {
            log.debug("Idle source sweep removed {} windows", removed);
        }
    }

    private AnalysisResult analyzeRecord(QueryRecord record) {
        long observedAt = record.getObservedAt() != null ? record.getObservedAt() : clock.millis();
        FeatureVector features = featureExtractor.extract(record.getSubject(), record.getSourceKey(), observedAt);

        ScoringResult scoring;
        try {
            scoring = scorer.score(features);
        } catch (ModelUnavailableException e) {
            metricsConfig.recordUnavailableModel();
            if (config.getUnscoredPolicy() == DetectionConfig.UnscoredPolicy.REJECT) {
                throw e;
            }
            log.warn("No model available; passing query from {} as NORMAL", record.getSourceKey());
            return buildResult(record, observedAt, features, ScoringResult.builder()
                    .score(0.0)
                    .severity(Severity.NORMAL)
                    .mode(ScoreMode.UNSCORED)
                    .build());
        }

        thresholdController.recordScore(scoring.getScore(), scoring.getSeverity(), observedAt);
        metricsConfig.recordAnalysis(scoring.getSeverity(), scoring.getMode(), scoring.getScore());

        if (scoring.getSeverity().isAlert()) {
            log.info("{} query from {}: {} (score={})", scoring.getSeverity(), record.getSourceKey(),
                    record.getSubject(), String.format("%.3f", scoring.getScore()));
        } else {
            log.debug("Query from {} scored {}", record.getSourceKey(), String.format("%.3f", scoring.getScore()));
        }

        return buildResult(record, observedAt, features, scoring);
    }

    // Under REJECT a query without a model must not reach its source window.
    private void rejectIfNoModel() {
        if (config.getUnscoredPolicy() == DetectionConfig.UnscoredPolicy.REJECT && !scorer.isReady()) {
            metricsConfig.recordUnavailableModel();
            throw new ModelUnavailableException("No fitted outlier model; train or load a model first");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private AnalysisResult buildResult(QueryRecord record, long observedAt,
                                       FeatureVector features, ScoringResult scoring) {
        return AnalysisResult.builder()
                .subject(record.getSubject())
                .sourceKey(record.getSourceKey())
                .observedAt(observedAt)
                .features(features)
                .score(scoring.getScore())
                .severity(scoring.getSeverity())
                .mode(scoring.getMode())
                .build();
    }
}
