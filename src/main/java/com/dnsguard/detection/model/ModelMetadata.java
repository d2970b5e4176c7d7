package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Metadata of the model currently used for scoring")
public class ModelMetadata {

    @Schema(description = "Outlier model type", example = "random-cut-forest")
    String modelType;

    @Schema(description = "Number of baseline vectors the model was fitted on", example = "5000")
    int trainingSamples;

    @Schema(description = "Training or load time in epoch milliseconds", example = "1739886764000")
    long trainedAt;

    @Schema(description = "Raw-score calibration baseline, null when uncalibrated")
    BaselineCalibration baseline;
}
