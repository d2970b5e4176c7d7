package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Snapshot of the adaptive threshold controller for reporting")
public class ThresholdStatistics {

    ThresholdState currentThresholds;

    PerformanceMetrics performance;

    AdjustmentStats adjustmentStats;

    @Schema(description = "Most recent threshold changes, oldest first")
    List<ThresholdChangeEvent> recentChanges;

    FeedbackSummary feedbackSummary;

    @Value
    @Builder
    public static class AdjustmentStats {
        long totalAdjustments;
        long increases;
        long decreases;
        @Schema(description = "Epoch milliseconds of the last adjustment, null if never adjusted")
        Long lastAdjustmentAt;
    }

    @Value
    @Builder
    public static class FeedbackSummary {
        long totalFeedback;
        long falsePositives;
        long truePositives;
        long last24Hours;
    }
}
