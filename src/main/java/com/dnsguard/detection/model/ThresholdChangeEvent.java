package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One committed threshold adjustment")
public class ThresholdChangeEvent {

    @Schema(example = "0.70")
    double oldSuspicious;

    @Schema(example = "0.72")
    double newSuspicious;

    @Schema(example = "0.85")
    double oldHigh;

    @Schema(example = "0.87")
    double newHigh;

    @Schema(description = "Reason code", example = "HIGH_FALSE_POSITIVE_RATE")
    AdjustmentReason reason;

    @Schema(description = "Human-readable explanation", example = "High false positive rate (13.33% > 10.00%)")
    String description;

    @Schema(description = "False-positive rate at the time of change", example = "0.1333")
    double falsePositiveRate;

    @Schema(description = "Alerts raised in the evaluation window at the time of change", example = "37")
    long alertVolume;

    @Schema(description = "Change time in epoch milliseconds", example = "1739886764000")
    long changedAt;
}
