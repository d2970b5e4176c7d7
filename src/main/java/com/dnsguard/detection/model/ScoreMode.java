package com.dnsguard.detection.model;

/**
 * How a normalized score was produced. Scores from different modes are not on the same scale.
 */
public enum ScoreMode {
    /** Min-max rescaled against the training baseline. */
    CALIBRATED,
    /** Baseline had zero range; score pinned to the 0.5 midpoint. */
    DEGENERATE_CALIBRATION,
    /** No baseline available; logistic squashing of the raw score. */
    UNCALIBRATED_LOGISTIC,
    /** No model was available and the service was configured to pass the query as NORMAL. */
    UNSCORED
}
