package com.dnsguard.detection.service;

import com.dnsguard.detection.config.AdaptiveThresholdConfig;
import com.dnsguard.detection.config.MetricsConfig;
import com.dnsguard.detection.engine.artifact.ModelArtifactCodec;
import com.dnsguard.detection.engine.artifact.ModelArtifactException;
import com.dnsguard.detection.engine.features.WindowedFeatureExtractor;
import com.dnsguard.detection.engine.scoring.AnomalyScorer;
import com.dnsguard.detection.engine.scoring.ModelUnavailableException;
import com.dnsguard.detection.engine.thresholds.AdaptiveThresholdController;
import com.dnsguard.detection.model.FeatureVector;
import com.dnsguard.detection.model.ModelMetadata;
import com.dnsguard.detection.testutil.LinearOutlierModel;
import com.dnsguard.detection.testutil.MutableClock;
import com.dnsguard.detection.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static com.dnsguard.detection.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    @Mock private MetricsConfig metricsConfig;

    private MutableClock clock;
    private AdaptiveThresholdController thresholdController;
    private AnomalyScorer scorer;
    private WindowedFeatureExtractor liveExtractor;
    private ModelArtifactCodec codec;
    private ModelTrainingService trainingService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(T0);
        thresholdController = new AdaptiveThresholdController(new AdaptiveThresholdConfig(), clock);
        scorer = new AnomalyScorer(LinearOutlierModel::new, thresholdController, clock);
        liveExtractor = new WindowedFeatureExtractor(60_000L, clock);
        codec = new ModelArtifactCodec(new ObjectMapper());
        codec.registerModelType(LinearOutlierModel.class, LinearOutlierModel.TYPE);
        trainingService = new ModelTrainingService(scorer, thresholdController, codec, liveExtractor,
                metricsConfig, clock);
    }

    @Test
    void train_installsModelWithoutTouchingLiveWindows() {
        ModelMetadata metadata = trainingService.train(TestDataFactory.benignTraffic(200));

        assertThat(metadata.getModelType()).isEqualTo(LinearOutlierModel.TYPE);
        assertThat(metadata.getTrainingSamples()).isEqualTo(200);
        assertThat(metadata.getBaseline()).isNotNull();
        assertThat(scorer.isReady()).isTrue();
        assertThat(liveExtractor.sourceCount()).isZero();
        verify(metricsConfig).recordModelTrained(200);
    }

    @Test
    void getMetadata_reportsInstallTimeFromClock() {
        trainingService.train(TestDataFactory.benignTraffic(50));
        assertThat(trainingService.getMetadata().getTrainedAt()).isEqualTo(T0);

        byte[] artifact = trainingService.exportArtifact();
        clock.advance(Duration.ofHours(2));
        trainingService.importArtifact(artifact);

        assertThat(trainingService.getMetadata().getTrainedAt()).isEqualTo(T0 + Duration.ofHours(2).toMillis());
    }

    @Test
    void train_emptyBaseline_rejected() {
        assertThatThrownBy(() -> trainingService.train(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(trainingService.getMetadata()).isNull();
    }

    @Test
    void exportArtifact_withoutModel_throws() {
        assertThatThrownBy(() -> trainingService.exportArtifact())
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    void exportThenImport_restoresIdenticalScoring() {
        trainingService.train(TestDataFactory.benignTraffic(100));
        FeatureVector probe = liveExtractor.extract(TestDataFactory.tunnelSubject(1), "10.9.9.9", T0);
        double before = scorer.score(probe).getScore();
        byte[] artifact = trainingService.exportArtifact();

        AnomalyScorer freshScorer = new AnomalyScorer(LinearOutlierModel::new, thresholdController, clock);
        ModelTrainingService freshService = new ModelTrainingService(freshScorer, thresholdController, codec,
                liveExtractor, metricsConfig, clock);
        ModelMetadata metadata = freshService.importArtifact(artifact);

        assertThat(metadata.getTrainingSamples()).isEqualTo(100);
        assertThat(freshScorer.score(probe).getScore()).isEqualTo(before);
        assertThat(freshScorer.calibration()).isEqualTo(scorer.calibration());
    }

    @Test
    void importArtifact_corrupt_rejected() {
        assertThatThrownBy(() -> trainingService.importArtifact("{\"schemaVersion\":".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ModelArtifactException.class);
        assertThat(scorer.isReady()).isFalse();
    }

    @Test
    void importArtifact_keepsLiveThresholds() {
        String legacy = "{\"model\":{\"type\":\"linear\",\"weights\":[1,1,1,1,1,1,1,1,1,1],\"fittedSamples\":3},"
                + "\"baselineScores\":[-30.0,-20.0,-10.0],\"thresholdSuspicious\":0.6,\"thresholdHigh\":0.9}";

        trainingService.importArtifact(legacy.getBytes(StandardCharsets.UTF_8));

        assertThat(scorer.isReady()).isTrue();
        assertThat(thresholdController.getCurrentThresholds().getSuspicious()).isEqualTo(0.70);
    }
}
