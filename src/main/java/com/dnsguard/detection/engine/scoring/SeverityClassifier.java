package com.dnsguard.detection.engine.scoring;

import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.model.ThresholdState;

public final class SeverityClassifier {

    private SeverityClassifier() {}

    public static Severity classify(double score, ThresholdState thresholds) {
        if (score >= thresholds.getHigh()) return Severity.HIGH;
        if (score >= thresholds.getSuspicious()) return Severity.SUSPICIOUS;
        return Severity.NORMAL;
    }
}
