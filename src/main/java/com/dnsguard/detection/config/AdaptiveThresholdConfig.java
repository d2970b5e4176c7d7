package com.dnsguard.detection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection.thresholds")
public class AdaptiveThresholdConfig {

    private double initialSuspicious = 0.70;
    private double initialHigh = 0.85;

    // False-positive band the controller steers towards.
    private double targetFpRate = 0.03;
    private double maxFpRate = 0.10;
    private double minFpRate = 0.01;

    // |fpRate - target| below this counts as on target.
    private double optimalBand = 0.01;

    // Above this FP rate the step is doubled.
    private double severeFpRate = 0.15;

    private double adjustmentIncrement = 0.02;

    // Safety limits for both thresholds.
    private double minThreshold = 0.50;
    private double maxThreshold = 0.95;

    // Gap restored when a clamp would collapse high onto suspicious.
    private double minSeparation = 0.10;

    private double highAlertRate = 0.10;
    private double lowAlertRate = 0.001;
    private long fewAlertsCount = 10;

    private int evaluationWindowHours = 24;
    private int minSamplesForAdjustment = 100;
    private int maxAdjustmentFrequencyHours = 6;
    private int feedbackRetentionDays = 30;

    private int scoreHistoryCapacity = 10_000;
    private int feedbackHistoryCapacity = 10_000;
    private int changeHistoryCapacity = 100;
    private int recentChangesReported = 10;

    // Periodic evaluation tick.
    private boolean tuningEnabled = true;
    private int checkIntervalMinutes = 60;
}
