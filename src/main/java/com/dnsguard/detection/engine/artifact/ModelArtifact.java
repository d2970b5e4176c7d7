package com.dnsguard.detection.engine.artifact;

import com.dnsguard.detection.engine.scoring.OutlierModel;
import com.dnsguard.detection.model.BaselineCalibration;
import com.dnsguard.detection.model.ThresholdState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Current (version 2) shape of a persisted scorer. Older shapes are upgraded by
 * {@link ModelArtifactUpgrader} before they are bound to this class.
 */
@Value
@Builder
@Jacksonized
public class ModelArtifact {

    public static final int CURRENT_SCHEMA_VERSION = 2;

    @Builder.Default
    int schemaVersion = CURRENT_SCHEMA_VERSION;

    OutlierModel model;

    // null when the model was saved without a calibration baseline
    BaselineCalibration baseline;

    // thresholds in effect when the artifact was written; null for legacy artifacts without them
    ThresholdState thresholds;

    int trainingSamples;

    long createdAt;
}
