package com.dnsguard.detection.model;

public enum Severity {
    NORMAL,
    SUSPICIOUS,
    HIGH;

    /** SUSPICIOUS and HIGH both count as alerts. */
    public boolean isAlert() {
        return this != NORMAL;
    }
}
