package com.dnsguard.detection.controller;

import com.dnsguard.detection.model.FeedbackEvent;
import com.dnsguard.detection.model.FeedbackRequest;
import com.dnsguard.detection.model.ThresholdChangeEvent;
import com.dnsguard.detection.model.ThresholdState;
import com.dnsguard.detection.model.ThresholdStatistics;
import com.dnsguard.detection.service.ThresholdTuningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Adaptive Thresholds", description = "Analyst feedback and feedback-driven threshold tuning")
public class ThresholdController {

    private final ThresholdTuningService tuningService;

    public ThresholdController(ThresholdTuningService tuningService) {
        this.tuningService = tuningService;
    }

    @Operation(summary = "Submit analyst feedback",
            description = "Records whether an alerted query was a false positive. Feedback drives the next threshold evaluation.")
    @PostMapping("/feedback")
    public ResponseEntity<?> submitFeedback(@RequestBody FeedbackRequest request) {
        try {
            FeedbackEvent event = tuningService.submitFeedback(request);
            return ResponseEntity.ok(event);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get current thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<ThresholdState> getThresholds() {
        return ResponseEntity.ok(tuningService.getCurrentThresholds());
    }

    @Operation(summary = "Get threshold statistics",
            description = "Current thresholds, performance over the evaluation window, adjustment counters, " +
                    "the most recent changes and a feedback summary.")
    @GetMapping("/thresholds/statistics")
    public ResponseEntity<ThresholdStatistics> getStatistics() {
        return ResponseEntity.ok(tuningService.getStatistics());
    }

    @Operation(summary = "Export threshold change history")
    @GetMapping("/thresholds/history")
    public ResponseEntity<List<ThresholdChangeEvent>> getHistory() {
        return ResponseEntity.ok(tuningService.getChangeHistory());
    }

    @Operation(summary = "Run a threshold evaluation now",
            description = "Runs the same evaluation as the scheduled tick. Cooldown and minimum-feedback gates still apply.")
    @PostMapping("/thresholds/adjust")
    public ResponseEntity<Map<String, Object>> adjust() {
        Optional<ThresholdChangeEvent> change = tuningService.runTuningCycle();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("adjusted", change.isPresent());
        response.put("thresholds", tuningService.getCurrentThresholds());
        change.ifPresent(c -> response.put("change", c));
        return ResponseEntity.ok(response);
    }
}
