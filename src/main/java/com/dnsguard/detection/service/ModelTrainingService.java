package com.dnsguard.detection.service;

import com.dnsguard.detection.config.MetricsConfig;
import com.dnsguard.detection.engine.artifact.ModelArtifact;
import com.dnsguard.detection.engine.artifact.ModelArtifactCodec;
import com.dnsguard.detection.engine.features.WindowedFeatureExtractor;
import com.dnsguard.detection.engine.scoring.AnomalyScorer;
import com.dnsguard.detection.engine.scoring.ModelUnavailableException;
import com.dnsguard.detection.engine.scoring.OutlierModel;
import com.dnsguard.detection.engine.thresholds.AdaptiveThresholdController;
import com.dnsguard.detection.model.BaselineCalibration;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.ModelMetadata;
import com.dnsguard.detection.model.QueryRecord;
import com.dnsguard.detection.model.ThresholdState;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final AnomalyScorer scorer;
    private final AdaptiveThresholdController thresholdController;
    private final ModelArtifactCodec artifactCodec;
    private final WindowedFeatureExtractor liveExtractor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ModelTrainingService(AnomalyScorer scorer,
                                AdaptiveThresholdController thresholdController,
                                ModelArtifactCodec artifactCodec,
                                WindowedFeatureExtractor liveExtractor,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.scorer = scorer;
        this.thresholdController = thresholdController;
        this.artifactCodec = artifactCodec;
        this.liveExtractor = liveExtractor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Train on baseline (benign) queries. Features are extracted with a private extractor so
     * the baseline does not leak into the live per-source windows.
     */
    @Observed(name = "model.train", contextualName = "train-model")
    public ModelMetadata train(List<QueryRecord> baseline) {
        if (baseline == null || baseline.isEmpty()) {
            throw new IllegalArgumentException("Training requires at least one baseline query");
        }
        log.info("Training model on {} baseline queries...", baseline.size());

        WindowedFeatureExtractor trainingExtractor =
                new WindowedFeatureExtractor(liveExtractor.getWindowMillis(), clock);
        List<FeatureVector> vectors = trainingExtractor.extractBatch(baseline);

        scorer.train(vectors);
        metricsConfig.recordModelTrained(vectors.size());
        return getMetadata();
    }

    /**
     * Snapshot of the installed model, its baseline and the live thresholds.
     *
     * @throws ModelUnavailableException if no model is installed
     */
    public byte[] exportArtifact() {
        OutlierModel model = scorer.model();
        if (model == null || !model.isFitted()) {
            throw new ModelUnavailableException("No fitted model to export");
        }
        ModelArtifact artifact = ModelArtifact.builder()
                .model(model)
                .baseline(scorer.calibration())
                .thresholds(thresholdController.getCurrentThresholds())
                .trainingSamples(scorer.trainingSamples())
                .createdAt(clock.millis())
                .build();
        return artifactCodec.toBytes(artifact);
    }

    /**
     * Installs a model from an artifact of any known schema version. Thresholds stored in the
     * artifact are informational: the live thresholds stay owned by the adaptive controller.
     */
    public ModelMetadata importArtifact(byte[] bytes) {
        ModelArtifact artifact = artifactCodec.fromBytes(bytes);
        scorer.install(artifact.getModel(), artifact.getBaseline(), artifact.getTrainingSamples());

        ThresholdState saved = artifact.getThresholds();
        ThresholdState live = thresholdController.getCurrentThresholds();
        if (saved != null && !saved.equals(live)) {
            log.info("Artifact was saved with thresholds {}/{}; keeping live thresholds {}/{}",
                    saved.getSuspicious(), saved.getHigh(), live.getSuspicious(), live.getHigh());
        }
        log.info("Loaded {} model ({} training samples)", artifact.getModel().modelType(), artifact.getTrainingSamples());
        return getMetadata();
    }

    /** @return metadata of the installed model, or null if none is installed */
    public ModelMetadata getMetadata() {
        if (!scorer.isReady()) {
            return null;
        }
        BaselineCalibration calibration = scorer.calibration();
        return ModelMetadata.builder()
                .modelType(scorer.model().modelType())
                .trainingSamples(scorer.trainingSamples())
                .trainedAt(scorer.installedAt())
                .baseline(calibration)
                .build();
    }
}
