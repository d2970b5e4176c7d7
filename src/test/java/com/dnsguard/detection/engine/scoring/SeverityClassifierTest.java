package com.dnsguard.detection.engine.scoring;

import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.model.ThresholdState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityClassifierTest {

    private final ThresholdState thresholds = new ThresholdState(0.70, 0.85);

    @Test
    void classify_belowSuspicious_isNormal() {
        assertThat(SeverityClassifier.classify(0.0, thresholds)).isEqualTo(Severity.NORMAL);
        assertThat(SeverityClassifier.classify(0.6999, thresholds)).isEqualTo(Severity.NORMAL);
    }

    @Test
    void classify_boundariesAreInclusive() {
        assertThat(SeverityClassifier.classify(0.70, thresholds)).isEqualTo(Severity.SUSPICIOUS);
        assertThat(SeverityClassifier.classify(0.85, thresholds)).isEqualTo(Severity.HIGH);
        assertThat(SeverityClassifier.classify(1.0, thresholds)).isEqualTo(Severity.HIGH);
    }

    @Test
    void classify_isMonotone() {
        Severity previous = Severity.NORMAL;
        for (int i = 0; i <= 100; i++) {
            Severity current = SeverityClassifier.classify(i / 100.0, thresholds);
            assertThat(current.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            previous = current;
        }
    }

    @Test
    void isAlert_onlyForSuspiciousAndHigh() {
        assertThat(Severity.NORMAL.isAlert()).isFalse();
        assertThat(Severity.SUSPICIOUS.isAlert()).isTrue();
        assertThat(Severity.HIGH.isAlert()).isTrue();
    }
}
