package com.dnsguard.detection.engine.scoring;

import com.dnsguard.detection.model.BaselineCalibration;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.ScoreMode;
import com.dnsguard.detection.model.ScoringResult;
import com.dnsguard.detection.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes raw outlier scores into [0, 1] anomaly scores and assigns a severity tier.
 *
 * Three normalization modes, reported on every result:
 *   CALIBRATED             clamp((max - raw) / (max - min), 0, 1) using the training baseline
 *   DEGENERATE_CALIBRATION baseline max == min, score fixed at 0.5
 *   UNCALIBRATED_LOGISTIC  no baseline, 1 / (1 + exp(5 * raw))
 *
 * The model and its baseline are swapped together as one immutable snapshot, so concurrent
 * scorers never see a new model with an old baseline.
 */
@Component
public class AnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScorer.class);

    static final double DEGENERATE_SCORE = 0.5;
    static final double LOGISTIC_STEEPNESS = 5.0;

    private final OutlierModelFactory modelFactory;
    private final ThresholdSource thresholds;
    private final Clock clock;

    private volatile Snapshot current = Snapshot.EMPTY;

    public AnomalyScorer(OutlierModelFactory modelFactory, ThresholdSource thresholds, Clock clock) {
        this.modelFactory = modelFactory;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    /**
     * Fits a fresh model on baseline vectors and recomputes the calibration by scoring the
     * same vectors with it.
     */
    public BaselineCalibration train(List<FeatureVector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Training requires at least one feature vector");
        }
        List<double[]> data = new ArrayList<>(vectors.size());
        for (FeatureVector v : vectors) {
            data.add(v.toArray());
        }

        OutlierModel model = modelFactory.create();
        model.fit(data);

        double[] raw = new double[data.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = model.score(data.get(i));
        }
        BaselineCalibration calibration = BaselineCalibration.fromScores(raw);

        current = new Snapshot(model, calibration, data.size(), clock.millis());

        log.info("Trained {} model on {} samples", model.modelType(), data.size());
        log.info("Baseline score range: [{}, {}], mean={}, std={}",
                String.format("%.4f", calibration.getMin()), String.format("%.4f", calibration.getMax()),
                String.format("%.4f", calibration.getMean()), String.format("%.4f", calibration.getStd()));
        return calibration;
    }

    /**
     * @throws ModelUnavailableException if no fitted model is installed
     */
    public ScoringResult score(FeatureVector vector) {
        Snapshot snapshot = current;
        if (snapshot.model == null || !snapshot.model.isFitted()) {
            throw new ModelUnavailableException("No fitted outlier model; train or load a model first");
        }

        double raw = snapshot.model.score(vector.toArray());

        double normalized;
        ScoreMode mode;
        BaselineCalibration calibration = snapshot.calibration;
        if (calibration == null) {
            normalized = logistic(raw);
            mode = ScoreMode.UNCALIBRATED_LOGISTIC;
        } else if (calibration.isDegenerate()) {
            normalized = DEGENERATE_SCORE;
            mode = ScoreMode.DEGENERATE_CALIBRATION;
        } else {
            normalized = calibrated(raw, calibration);
            mode = ScoreMode.CALIBRATED;
        }

        Severity severity = SeverityClassifier.classify(normalized, thresholds.currentThresholds());
        return ScoringResult.builder()
                .score(normalized)
                .severity(severity)
                .mode(mode)
                .build();
    }

    public List<ScoringResult> scoreBatch(List<FeatureVector> vectors) {
        List<ScoringResult> results = new ArrayList<>(vectors.size());
        for (FeatureVector v : vectors) {
            results.add(score(v));
        }
        return results;
    }

    /**
     * Installs an already fitted model, e.g. one restored from an artifact.
     * A null calibration puts the scorer in logistic fallback mode.
     */
    public void install(OutlierModel model, BaselineCalibration calibration, int trainingSamples) {
        if (model == null || !model.isFitted()) {
            throw new IllegalArgumentException("Only a fitted model can be installed");
        }
        if (calibration == null) {
            log.warn("Installing {} model without a baseline; scores use the uncalibrated logistic mode",
                    model.modelType());
        }
        current = new Snapshot(model, calibration, trainingSamples, clock.millis());
    }

    public boolean isReady() {
        Snapshot snapshot = current;
        return snapshot.model != null && snapshot.model.isFitted();
    }

    public OutlierModel model() {
        return current.model;
    }

    public BaselineCalibration calibration() {
        return current.calibration;
    }

    public int trainingSamples() {
        return current.trainingSamples;
    }

    public long installedAt() {
        return current.installedAt;
    }

    static double calibrated(double raw, BaselineCalibration calibration) {
        double range = calibration.getMax() - calibration.getMin();
        double score = (calibration.getMax() - raw) / range;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double logistic(double raw) {
        return 1.0 / (1.0 + Math.exp(LOGISTIC_STEEPNESS * raw));
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(null, null, 0, 0L);

        final OutlierModel model;
        final BaselineCalibration calibration;
        final int trainingSamples;
        final long installedAt;

        Snapshot(OutlierModel model, BaselineCalibration calibration, int trainingSamples, long installedAt) {
            this.model = model;
            this.calibration = calibration;
            this.trainingSamples = trainingSamples;
            this.installedAt = installedAt;
        }
    }
}
