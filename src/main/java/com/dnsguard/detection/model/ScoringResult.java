package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Normalized anomaly score with its severity tier")
public class ScoringResult {

    @Schema(description = "Normalized anomaly score in [0, 1]; higher is more anomalous", example = "0.82")
    double score;

    @Schema(description = "Severity tier under the thresholds in effect at scoring time", example = "SUSPICIOUS")
    Severity severity;

    @Schema(description = "Normalization mode that produced the score", example = "CALIBRATED")
    ScoreMode mode;
}
