package com.dnsguard.detection.config;

import com.dnsguard.detection.model.ScoreMode;
import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.model.ThresholdChangeEvent;
import com.dnsguard.detection.model.ThresholdState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong suspiciousThresholdBits = new AtomicLong();
    private final AtomicLong highThresholdBits = new AtomicLong();
    private final AtomicInteger activeSources;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("threshold.suspicious", suspiciousThresholdBits, b -> Double.longBitsToDouble(b.get()));
        registry.gauge("threshold.high", highThresholdBits, b -> Double.longBitsToDouble(b.get()));
        this.activeSources = registry.gauge("window.active.sources", new AtomicInteger(0));
    }

    public void recordAnalysis(Severity severity, ScoreMode mode, double score) {
        Counter.builder("analysis.count")
                .tag("severity", severity.name())
                .tag("mode", mode.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.score")
                .tag("mode", mode.name())
                .register(registry)
                .record(score);
    }

    public void recordUnavailableModel() {
        Counter.builder("analysis.model_unavailable.count")
                .register(registry)
                .increment();
    }

    public void recordFeedback(boolean falsePositive) {
        Counter.builder("feedback.count")
                .tag("verdict", falsePositive ? "false_positive" : "true_positive")
                .register(registry)
                .increment();
    }

    public void recordThresholdAdjustment(ThresholdChangeEvent change) {
        Counter.builder("threshold.adjustment.count")
                .tag("reason", change.getReason().name())
                .tag("direction", change.getNewSuspicious() > change.getOldSuspicious() ? "increase" : "decrease")
                .register(registry)
                .increment();
        updateThresholds(new ThresholdState(change.getNewSuspicious(), change.getNewHigh()));
    }

    public void recordModelTrained(int samples) {
        Counter.builder("model.training.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("model.training.samples")
                .register(registry)
                .record(samples);
    }

    public void updateThresholds(ThresholdState thresholds) {
        suspiciousThresholdBits.set(Double.doubleToLongBits(thresholds.getSuspicious()));
        highThresholdBits.set(Double.doubleToLongBits(thresholds.getHigh()));
    }

    public void updateActiveSourceCount(int count) {
        activeSources.set(count);
    }
}
