package com.dnsguard.detection.service;

import com.dnsguard.detection.config.MetricsConfig;
import com.dnsguard.detection.engine.thresholds.AdaptiveThresholdController;
import com.dnsguard.detection.model.FeedbackEvent;
import com.dnsguard.detection.model.FeedbackRequest;
import com.dnsguard.detection.model.ThresholdChangeEvent;
import com.dnsguard.detection.model.ThresholdState;
import com.dnsguard.detection.model.ThresholdStatistics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ThresholdTuningService {

    private static final Logger log = LoggerFactory.getLogger(ThresholdTuningService.class);

    private final AdaptiveThresholdController controller;
    private final MetricsConfig metricsConfig;

    public ThresholdTuningService(AdaptiveThresholdController controller, MetricsConfig metricsConfig) {
        this.controller = controller;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    void publishInitialThresholds() {
        metricsConfig.updateThresholds(controller.getCurrentThresholds());
    }

    /**
     * @throws IllegalArgumentException if a required field is missing or the score is outside [0, 1]
     */
    public FeedbackEvent submitFeedback(FeedbackRequest request) {
        if (request.getSubjectId() == null || request.getSubjectId().isBlank()) {
            throw new IllegalArgumentException("subjectId is required");
        }
        if (request.getFalsePositive() == null) {
            throw new IllegalArgumentException("falsePositive is required");
        }
        if (request.getScore() == null || request.getScore() < 0.0 || request.getScore() > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]");
        }
        if (request.getAnalyst() == null || request.getAnalyst().isBlank()) {
            throw new IllegalArgumentException("analyst is required");
        }

        FeedbackEvent event = controller.addFeedback(request.getSubjectId(), request.getFalsePositive(),
                request.getScore(), request.getAnalyst(), request.getNotes());
        metricsConfig.recordFeedback(event.isFalsePositive());
        return event;
    }

    /** One evaluation tick; shared by the scheduler and the manual trigger. */
    public Optional<ThresholdChangeEvent> runTuningCycle() {
        log.debug("Checking if threshold adjustment is needed...");
        Optional<ThresholdChangeEvent> change = controller.evaluate();
        change.ifPresentOrElse(
                metricsConfig::recordThresholdAdjustment,
                () -> log.debug("No threshold adjustment needed"));
        return change;
    }

    public ThresholdState getCurrentThresholds() {
        return controller.getCurrentThresholds();
    }

    public ThresholdStatistics getStatistics() {
        return controller.getStatistics();
    }

    public List<ThresholdChangeEvent> getChangeHistory() {
        return controller.getChangeHistory();
    }
}
