package com.dnsguard.detection.engine.scoring;

import com.dnsguard.detection.model.ThresholdState;

@FunctionalInterface
public interface ThresholdSource {

    ThresholdState currentThresholds();
}
