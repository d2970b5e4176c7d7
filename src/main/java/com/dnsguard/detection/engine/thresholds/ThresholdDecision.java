package com.dnsguard.detection.engine.thresholds;

import com.dnsguard.detection.config.AdaptiveThresholdConfig;
import com.dnsguard.detection.model.AdjustmentReason;
import com.dnsguard.detection.model.PerformanceMetrics;

/**
 * Direction and size of one threshold move. Rules are checked in order and the first match
 * wins; an on-target FP rate short-circuits to no move.
 */
final class ThresholdDecision {

    final double delta;
    final AdjustmentReason reason;
    final String description;

    private ThresholdDecision(double delta, AdjustmentReason reason, String description) {
        this.delta = delta;
        this.reason = reason;
        this.description = description;
    }

    /** @return the move to make, or null when thresholds should stay where they are */
    static ThresholdDecision decide(PerformanceMetrics metrics, AdaptiveThresholdConfig config) {
        double fpRate = metrics.getFalsePositiveRate();
        double alertRate = metrics.getAlertRate();
        double increment = config.getAdjustmentIncrement();

        if (fpRate >= config.getMinFpRate() && fpRate <= config.getMaxFpRate()
                && Math.abs(fpRate - config.getTargetFpRate()) < config.getOptimalBand()) {
            return null;
        }

        if (fpRate > config.getMaxFpRate()) {
            double step = fpRate > config.getSevereFpRate() ? increment * 2 : increment;
            return new ThresholdDecision(step, AdjustmentReason.HIGH_FALSE_POSITIVE_RATE,
                    String.format("High false positive rate (%.2f%% > %.2f%%)",
                            fpRate * 100, config.getMaxFpRate() * 100));
        }
        if (fpRate < config.getMinFpRate() && metrics.getTotalAlerts() < config.getFewAlertsCount()) {
            return new ThresholdDecision(-increment, AdjustmentReason.LOW_FALSE_POSITIVE_RATE_FEW_ALERTS,
                    String.format("Very low FP rate (%.2f%%) with few alerts - may be missing threats",
                            fpRate * 100));
        }
        if (alertRate > config.getHighAlertRate()) {
            return new ThresholdDecision(increment, AdjustmentReason.HIGH_ALERT_VOLUME,
                    String.format("Alert volume too high (%.1f%% of queries)", alertRate * 100));
        }
        if (alertRate < config.getLowAlertRate() && fpRate < config.getTargetFpRate()) {
            return new ThresholdDecision(-increment * 0.5, AdjustmentReason.LOW_ALERT_VOLUME,
                    String.format("Very few alerts (%.2f%%), safe to be more sensitive", alertRate * 100));
        }
        return null;
    }
}
