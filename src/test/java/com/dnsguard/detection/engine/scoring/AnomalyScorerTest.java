package com.dnsguard.detection.engine.scoring;

import com.dnsguard.detection.model.BaselineCalibration;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.ScoreMode;
import com.dnsguard.detection.model.ScoringResult;
import com.dnsguard.detection.model.Severity;
import com.dnsguard.detection.testutil.LinearOutlierModel;
import com.dnsguard.detection.testutil.MutableClock;
import com.dnsguard.detection.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dnsguard.detection.testutil.TestDataFactory.T0;
import static com.dnsguard.detection.testutil.TestDataFactory.uniformVector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyScorerTest {

    private AnomalyScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new AnomalyScorer(LinearOutlierModel::new, () -> TestDataFactory.thresholds(0.70, 0.85),
                MutableClock.startingAt(T0));
    }

    @Test
    void score_withoutModel_throwsModelUnavailable() {
        assertThat(scorer.isReady()).isFalse();
        assertThatThrownBy(() -> scorer.score(uniformVector(1.0)))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void train_emptySet_rejected() {
        assertThatThrownBy(() -> scorer.train(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(scorer.isReady()).isFalse();
    }

    @Test
    void train_buildsCalibrationFromTrainingScores() {
        // raw scores are -10 * value: -10, -20, -30
        BaselineCalibration cal = scorer.train(List.of(uniformVector(1.0), uniformVector(2.0), uniformVector(3.0)));

        assertThat(cal.getMin()).isCloseTo(-30.0, within(1e-9));
        assertThat(cal.getMax()).isCloseTo(-10.0, within(1e-9));
        assertThat(cal.getMean()).isCloseTo(-20.0, within(1e-9));
        assertThat(cal.getStd()).isCloseTo(Math.sqrt(200.0 / 3.0), within(1e-9));
        assertThat(scorer.isReady()).isTrue();
        assertThat(scorer.trainingSamples()).isEqualTo(3);
    }

    @Test
    void score_calibrated_mapsBaselineRangeOntoUnitInterval() {
        scorer.train(List.of(uniformVector(1.0), uniformVector(2.0), uniformVector(3.0)));

        assertThat(scorer.score(uniformVector(1.0)).getScore()).isCloseTo(0.0, within(1e-12));
        assertThat(scorer.score(uniformVector(2.0)).getScore()).isCloseTo(0.5, within(1e-12));
        assertThat(scorer.score(uniformVector(3.0)).getScore()).isCloseTo(1.0, within(1e-12));
        assertThat(scorer.score(uniformVector(2.0)).getMode()).isEqualTo(ScoreMode.CALIBRATED);
    }

    @Test
    void score_calibrated_clampsOutsideBaseline() {
        scorer.train(List.of(uniformVector(1.0), uniformVector(3.0)));

        assertThat(scorer.score(uniformVector(0.0)).getScore()).isEqualTo(0.0);
        ScoringResult extreme = scorer.score(uniformVector(50.0));
        assertThat(extreme.getScore()).isEqualTo(1.0);
        assertThat(extreme.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void score_isMonotoneInRawScore() {
        scorer.train(List.of(uniformVector(0.5), uniformVector(4.0)));

        double previous = -1.0;
        for (int i = 0; i <= 40; i++) {
            double score = scorer.score(uniformVector(i * 0.125)).getScore();
            assertThat(score).isBetween(0.0, 1.0);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void score_degenerateBaseline_returnsHalf() {
        scorer.train(List.of(uniformVector(2.0), uniformVector(2.0)));

        ScoringResult result = scorer.score(uniformVector(9.0));
        assertThat(result.getScore()).isEqualTo(0.5);
        assertThat(result.getMode()).isEqualTo(ScoreMode.DEGENERATE_CALIBRATION);
        assertThat(result.getSeverity()).isEqualTo(Severity.NORMAL);
    }

    @Test
    void score_withoutCalibration_usesLogistic() {
        LinearOutlierModel model = new LinearOutlierModel();
        model.fit(List.of(uniformVector(0.0).toArray()));
        scorer.install(model, null, 1);

        ScoringResult atZero = scorer.score(uniformVector(0.0));
        assertThat(atZero.getScore()).isCloseTo(0.5, within(1e-12));
        assertThat(atZero.getMode()).isEqualTo(ScoreMode.UNCALIBRATED_LOGISTIC);

        // raw = -1 => 1 / (1 + e^-5)
        ScoringResult anomalous = scorer.score(uniformVector(0.1));
        assertThat(anomalous.getScore()).isCloseTo(1.0 / (1.0 + Math.exp(-5.0)), within(1e-9));
        assertThat(anomalous.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void score_severityFollowsLiveThresholds() {
        double[] suspicious = {0.70};
        AnomalyScorer live = new AnomalyScorer(LinearOutlierModel::new,
                () -> TestDataFactory.thresholds(suspicious[0], 0.85), MutableClock.startingAt(T0));
        live.train(List.of(uniformVector(0.0), uniformVector(1.0)));

        FeatureVector v = uniformVector(0.75);
        assertThat(live.score(v).getSeverity()).isEqualTo(Severity.SUSPICIOUS);
        suspicious[0] = 0.80;
        assertThat(live.score(v).getSeverity()).isEqualTo(Severity.NORMAL);
    }

    @Test
    void install_unfittedModel_rejected() {
        assertThatThrownBy(() -> scorer.install(new LinearOutlierModel(), null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scoreBatch_scoresEachVector() {
        scorer.train(List.of(uniformVector(0.0), uniformVector(1.0)));
        List<FeatureVector> batch = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            batch.add(uniformVector(i * 0.25));
        }

        List<ScoringResult> results = scorer.scoreBatch(batch);
        assertThat(results).extracting(ScoringResult::getScore)
                .containsExactly(0.0, 0.25, 0.5, 0.75, 1.0);
    }
}
