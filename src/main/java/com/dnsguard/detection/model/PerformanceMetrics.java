package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Detection performance over the evaluation window")
public class PerformanceMetrics {

    public static final PerformanceMetrics EMPTY = PerformanceMetrics.builder().build();

    @Schema(description = "Scored queries in the window", example = "15230")
    long totalScored;

    @Schema(description = "Scored queries that were SUSPICIOUS or HIGH", example = "41")
    long totalAlerts;

    @Schema(example = "3")
    long falsePositives;

    @Schema(example = "97")
    long truePositives;

    @Schema(description = "FP / (FP + TP); 0 without feedback", example = "0.03")
    double falsePositiveRate;

    @Schema(description = "alerts / scored; 0 without scores", example = "0.0027")
    double alertRate;

    @Schema(example = "0.31")
    double meanScore;

    @Schema(example = "0.12")
    double scoreStdDev;
}
