package com.dnsguard.detection.model;

public enum AdjustmentReason {
    HIGH_FALSE_POSITIVE_RATE,
    LOW_FALSE_POSITIVE_RATE_FEW_ALERTS,
    HIGH_ALERT_VOLUME,
    LOW_ALERT_VOLUME
}
