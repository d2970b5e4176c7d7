package com.dnsguard.detection.engine.thresholds;

import com.dnsguard.detection.config.AdaptiveThresholdConfig;
import com.dnsguard.detection.engine.scoring.ThresholdSource;
import com.dnsguard.detection.model.FeedbackEvent;
import com.dnsguard.detection.model.PerformanceMetrics;
import com.dnsguard.detection.model.ScoreSample;
import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.model.ThresholdChangeEvent;
import com.dnsguard.detection.model.ThresholdState;
import com.dnsguard.detection.model.ThresholdStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the severity thresholds calibrated against analyst feedback.
 *
 * Scores and feedback accumulate between evaluation ticks. On each tick the controller
 * checks the cooldown and the minimum feedback sample, computes the false-positive rate and
 * alert rate over the evaluation window, and moves both thresholds by a fixed step within
 * [minThreshold, maxThreshold].
 *
 * All history mutation and the adjustment itself run under one lock. The live
 * {@link ThresholdState} is published through an {@link AtomicReference}, so severity
 * classification reads it without blocking.
 */
@Component
public class AdaptiveThresholdController implements ThresholdSource {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveThresholdController.class);

    private static final Duration FEEDBACK_SUMMARY_WINDOW = Duration.ofHours(24);

    private final AdaptiveThresholdConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<ThresholdState> thresholds;
    private final Deque<ScoreSample> scoreHistory = new ArrayDeque<>();
    private final Deque<FeedbackEvent> feedback = new ArrayDeque<>();
    private final Deque<ThresholdChangeEvent> changeHistory = new ArrayDeque<>();

    private Long lastAdjustmentAt;
    private long totalAdjustments;
    private long totalIncreases;
    private long totalDecreases;

    public AdaptiveThresholdController(AdaptiveThresholdConfig config, Clock clock) {
        validate(config);
        this.config = config;
        this.clock = clock;
        this.thresholds = new AtomicReference<>(
                new ThresholdState(config.getInitialSuspicious(), config.getInitialHigh()));

        log.info("Adaptive threshold controller initialized");
        log.info("Initial thresholds - Suspicious: {}, High: {}", config.getInitialSuspicious(), config.getInitialHigh());
        log.info("Target FP rate: {}%, Max: {}%, Min: {}%",
                config.getTargetFpRate() * 100, config.getMaxFpRate() * 100, config.getMinFpRate() * 100);
    }

    // ── Ingestion ──

    public void recordScore(double score, Severity severity, long observedAt) {
        lock.lock();
        try {
            scoreHistory.addLast(new ScoreSample(score, severity, observedAt));
            while (scoreHistory.size() > config.getScoreHistoryCapacity()) {
                scoreHistory.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    public FeedbackEvent addFeedback(String subjectId, boolean falsePositive, double score,
                                     String analyst, String notes) {
        FeedbackEvent event;
        lock.lock();
        try {
            // stamped under the lock so the deque stays ordered by receivedAt
            long now = clock.millis();
            event = FeedbackEvent.builder()
                    .subjectId(subjectId)
                    .falsePositive(falsePositive)
                    .score(score)
                    .analyst(analyst)
                    .notes(notes)
                    .receivedAt(now)
                    .build();
            feedback.addLast(event);

            long cutoff = now - Duration.ofDays(config.getFeedbackRetentionDays()).toMillis();
            while (!feedback.isEmpty() && feedback.peekFirst().getReceivedAt() <= cutoff) {
                feedback.removeFirst();
            }
            while (feedback.size() > config.getFeedbackHistoryCapacity()) {
                feedback.removeFirst();
            }
        } finally {
            lock.unlock();
        }

        log.info("Feedback recorded - Alert {}: {} (score: {}) by {}",
                subjectId, falsePositive ? "FALSE POSITIVE" : "TRUE POSITIVE",
                String.format("%.3f", score), analyst);
        return event;
    }

    // ── Evaluation ──

    /** False during cooldown or while the evaluation window holds too little feedback. */
    public boolean shouldAdjust() {
        lock.lock();
        try {
            return shouldAdjustLocked(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one evaluation tick.
     *
     * @return true if the thresholds changed
     */
    public boolean adjust() {
        return evaluate().isPresent();
    }

    /**
     * Runs one evaluation tick and returns the committed change, if any.
     */
    public Optional<ThresholdChangeEvent> evaluate() {
        lock.lock();
        try {
            long now = clock.millis();
            if (!shouldAdjustLocked(now)) {
                return Optional.empty();
            }

            PerformanceMetrics metrics = computeMetricsLocked(now, evaluationWindow());
            log.info("Performance metrics - FP rate: {}%, Alert rate: {}%, Alerts: {}, FPs: {}, TPs: {}",
                    String.format("%.2f", metrics.getFalsePositiveRate() * 100),
                    String.format("%.2f", metrics.getAlertRate() * 100),
                    metrics.getTotalAlerts(), metrics.getFalsePositives(), metrics.getTruePositives());

            ThresholdDecision decision = ThresholdDecision.decide(metrics, config);
            if (decision == null) {
                log.debug("FP rate {}% needs no adjustment",
                        String.format("%.2f", metrics.getFalsePositiveRate() * 100));
                return Optional.empty();
            }

            ThresholdState old = thresholds.get();
            ThresholdState proposed = applyDelta(old, decision.delta);
            if (proposed.getSuspicious() == old.getSuspicious() && proposed.getHigh() == old.getHigh()) {
                log.debug("Thresholds already at their safety limit for {}; no change", decision.reason);
                return Optional.empty();
            }

            ThresholdChangeEvent change = ThresholdChangeEvent.builder()
                    .oldSuspicious(old.getSuspicious())
                    .newSuspicious(proposed.getSuspicious())
                    .oldHigh(old.getHigh())
                    .newHigh(proposed.getHigh())
                    .reason(decision.reason)
                    .description(decision.description)
                    .falsePositiveRate(metrics.getFalsePositiveRate())
                    .alertVolume(metrics.getTotalAlerts())
                    .changedAt(now)
                    .build();

            thresholds.set(proposed);
            changeHistory.addLast(change);
            while (changeHistory.size() > config.getChangeHistoryCapacity()) {
                changeHistory.removeFirst();
            }
            lastAdjustmentAt = now;
            totalAdjustments++;
            String direction;
            if (decision.delta > 0) {
                totalIncreases++;
                direction = "INCREASED";
            } else {
                totalDecreases++;
                direction = "DECREASED";
            }

            log.warn("THRESHOLDS {}: Suspicious: {} -> {}, High: {} -> {}",
                    direction,
                    String.format("%.3f", old.getSuspicious()), String.format("%.3f", proposed.getSuspicious()),
                    String.format("%.3f", old.getHigh()), String.format("%.3f", proposed.getHigh()));
            log.warn("   Reason: {}", decision.description);
            log.warn("   Metrics: FP rate={}%, Alerts={}, FPs={}, TPs={}",
                    String.format("%.2f", metrics.getFalsePositiveRate() * 100),
                    metrics.getTotalAlerts(), metrics.getFalsePositives(), metrics.getTruePositives());
            return Optional.of(change);
        } finally {
            lock.unlock();
        }
    }

    public PerformanceMetrics computeMetrics() {
        return computeMetrics(evaluationWindow());
    }

    public PerformanceMetrics computeMetrics(Duration window) {
        lock.lock();
        try {
            return computeMetricsLocked(clock.millis(), window);
        } finally {
            lock.unlock();
        }
    }

    // ── Reporting ──

    public ThresholdState getCurrentThresholds() {
        return thresholds.get();
    }

    @Override
    public ThresholdState currentThresholds() {
        return thresholds.get();
    }

    public ThresholdStatistics getStatistics() {
        lock.lock();
        try {
            long now = clock.millis();
            PerformanceMetrics metrics = computeMetricsLocked(now, evaluationWindow());

            List<ThresholdChangeEvent> changes = new ArrayList<>(changeHistory);
            int from = Math.max(0, changes.size() - config.getRecentChangesReported());

            long fps = feedback.stream().filter(FeedbackEvent::isFalsePositive).count();
            long summaryCutoff = now - FEEDBACK_SUMMARY_WINDOW.toMillis();
            long last24h = feedback.stream().filter(f -> f.getReceivedAt() > summaryCutoff).count();

            return ThresholdStatistics.builder()
                    .currentThresholds(thresholds.get())
                    .performance(metrics)
                    .adjustmentStats(ThresholdStatistics.AdjustmentStats.builder()
                            .totalAdjustments(totalAdjustments)
                            .increases(totalIncreases)
                            .decreases(totalDecreases)
                            .lastAdjustmentAt(lastAdjustmentAt)
                            .build())
                    .recentChanges(List.copyOf(changes.subList(from, changes.size())))
                    .feedbackSummary(ThresholdStatistics.FeedbackSummary.builder()
                            .totalFeedback(feedback.size())
                            .falsePositives(fps)
                            .truePositives(feedback.size() - fps)
                            .last24Hours(last24h)
                            .build())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** All retained change events, oldest first. */
    public List<ThresholdChangeEvent> getChangeHistory() {
        lock.lock();
        try {
            return List.copyOf(changeHistory);
        } finally {
            lock.unlock();
        }
    }

    public int getScoreHistorySize() {
        lock.lock();
        try {
            return scoreHistory.size();
        } finally {
            lock.unlock();
        }
    }

    public int getFeedbackCount() {
        lock.lock();
        try {
            return feedback.size();
        } finally {
            lock.unlock();
        }
    }

    // ── Internals (caller holds the lock) ──

    private boolean shouldAdjustLocked(long now) {
        if (lastAdjustmentAt != null) {
            long sinceLast = now - lastAdjustmentAt;
            if (sinceLast < Duration.ofHours(config.getMaxAdjustmentFrequencyHours()).toMillis()) {
                log.debug("Threshold cooldown active ({} min since last adjustment)", sinceLast / 60_000);
                return false;
            }
        }

        long cutoff = now - evaluationWindow().toMillis();
        long recent = feedback.stream().filter(f -> f.getReceivedAt() > cutoff).count();
        if (recent < config.getMinSamplesForAdjustment()) {
            log.debug("Not enough feedback samples for adjustment ({} < {})",
                    recent, config.getMinSamplesForAdjustment());
            return false;
        }
        return true;
    }

    private PerformanceMetrics computeMetricsLocked(long now, Duration window) {
        long cutoff = now - window.toMillis();

        long scored = 0;
        long alerts = 0;
        double sum = 0.0;
        double sumSq = 0.0;
        for (ScoreSample s : scoreHistory) {
            if (s.getObservedAt() <= cutoff) continue;
            scored++;
            if (s.getSeverity().isAlert()) alerts++;
            sum += s.getScore();
            sumSq += s.getScore() * s.getScore();
        }

        long fps = 0;
        long tps = 0;
        for (FeedbackEvent f : feedback) {
            if (f.getReceivedAt() <= cutoff) continue;
            if (f.isFalsePositive()) fps++;
            else tps++;
        }

        double mean = scored > 0 ? sum / scored : 0.0;
        double variance = scored > 0 ? Math.max(0.0, sumSq / scored - mean * mean) : 0.0;

        return PerformanceMetrics.builder()
                .totalScored(scored)
                .totalAlerts(alerts)
                .falsePositives(fps)
                .truePositives(tps)
                .falsePositiveRate(fps + tps > 0 ? (double) fps / (fps + tps) : 0.0)
                .alertRate(scored > 0 ? (double) alerts / scored : 0.0)
                .meanScore(mean)
                .scoreStdDev(Math.sqrt(variance))
                .build();
    }

    private ThresholdState applyDelta(ThresholdState current, double delta) {
        double min = config.getMinThreshold();
        double max = config.getMaxThreshold();

        double suspicious = round(clamp(current.getSuspicious() + delta, min, max));
        double high = round(clamp(current.getHigh() + delta, min, max));

        if (high <= suspicious) {
            high = round(Math.min(suspicious + config.getMinSeparation(), max));
        }
        // only reachable when both are pinned at maxThreshold; suspicious stays below high
        if (high <= suspicious) {
            suspicious = round(Math.max(current.getSuspicious(), high - config.getMinSeparation()));
        }
        return new ThresholdState(suspicious, high);
    }

    private Duration evaluationWindow() {
        return Duration.ofHours(config.getEvaluationWindowHours());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    // absorbs binary drift from repeated steps; far finer than any usable increment
    private static double round(double value) {
        return Math.round(value * 1e9) / 1e9;
    }

    private static void validate(AdaptiveThresholdConfig config) {
        if (!(config.getMinThreshold() < config.getMaxThreshold())) {
            throw new IllegalArgumentException("minThreshold must be below maxThreshold");
        }
        if (config.getInitialSuspicious() < config.getMinThreshold()
                || config.getInitialHigh() > config.getMaxThreshold()
                || !(config.getInitialSuspicious() < config.getInitialHigh())) {
            throw new IllegalArgumentException(String.format(
                    "Initial thresholds must satisfy %.3f <= suspicious (%.3f) < high (%.3f) <= %.3f",
                    config.getMinThreshold(), config.getInitialSuspicious(),
                    config.getInitialHigh(), config.getMaxThreshold()));
        }
        if (config.getAdjustmentIncrement() <= 0) {
            throw new IllegalArgumentException("adjustmentIncrement must be > 0");
        }
        if (config.getScoreHistoryCapacity() <= 0 || config.getFeedbackHistoryCapacity() <= 0
                || config.getChangeHistoryCapacity() <= 0) {
            throw new IllegalArgumentException("history capacities must be > 0");
        }
    }
}
