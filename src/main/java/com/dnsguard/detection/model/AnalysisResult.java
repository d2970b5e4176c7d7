package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of analysing a single DNS query")
public class AnalysisResult {

    @Schema(example = "a3f8b2c9d4e5f6a7b8c9d0e1f2a3b4c5.evil.com")
    String subject;

    @Schema(example = "192.168.1.100")
    String sourceKey;

    @Schema(description = "Observation time in epoch milliseconds", example = "1739886764000")
    long observedAt;

    @Schema(description = "Extracted features keyed by feature name")
    FeatureVector features;

    @Schema(example = "0.91")
    double score;

    @Schema(example = "HIGH")
    Severity severity;

    @Schema(example = "CALIBRATED")
    ScoreMode mode;
}
