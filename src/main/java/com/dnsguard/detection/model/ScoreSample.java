package com.dnsguard.detection.model;

import lombok.Value;

@Value
public class ScoreSample {
    double score;
    Severity severity;
    long observedAt;
}
