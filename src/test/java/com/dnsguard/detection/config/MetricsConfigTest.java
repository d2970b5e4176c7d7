package com.dnsguard.detection.config;

import com.dnsguard.detection.model.AdjustmentReason;
import com.dnsguard.detection.model.ScoreMode;
import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsConfigTest {

    private SimpleMeterRegistry registry;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
    }

    @Test
    void recordAnalysis_countsBySeverityAndMode() {
        metricsConfig.recordAnalysis(Severity.HIGH, ScoreMode.CALIBRATED, 0.9);
        metricsConfig.recordAnalysis(Severity.HIGH, ScoreMode.CALIBRATED, 0.95);
        metricsConfig.recordAnalysis(Severity.NORMAL, ScoreMode.UNCALIBRATED_LOGISTIC, 0.1);

        assertThat(registry.get("analysis.count").tags("severity", "HIGH", "mode", "CALIBRATED").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("analysis.score").tag("mode", "CALIBRATED").summary().count()).isEqualTo(2);
    }

    @Test
    void recordThresholdAdjustment_updatesGauges() {
        metricsConfig.updateThresholds(TestDataFactory.thresholds(0.70, 0.85));
        assertThat(registry.get("threshold.suspicious").gauge().value()).isEqualTo(0.70);

        metricsConfig.recordThresholdAdjustment(TestDataFactory.change(0.70, 0.72, 0.85, 0.87,
                AdjustmentReason.HIGH_FALSE_POSITIVE_RATE));

        assertThat(registry.get("threshold.suspicious").gauge().value()).isEqualTo(0.72);
        assertThat(registry.get("threshold.high").gauge().value()).isEqualTo(0.87);
        assertThat(registry.get("threshold.adjustment.count").tag("direction", "increase").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void updateActiveSourceCount_setsGauge() {
        metricsConfig.updateActiveSourceCount(12);

        assertThat(registry.get("window.active.sources").gauge().value()).isEqualTo(12.0);
    }
}
