package com.dnsguard.detection.controller;

import com.dnsguard.detection.engine.scoring.ModelUnavailableException;
import com.dnsguard.detection.model.AnalysisResult;
import com.dnsguard.detection.model.QueryRecord;
import com.dnsguard.detection.service.QueryAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/dns")
@Tag(name = "DNS Analysis", description = "Score DNS queries for tunnelling behaviour")
public class AnalysisController {

    private final QueryAnalysisService analysisService;

    public AnalysisController(QueryAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Operation(summary = "Analyse a single DNS query",
            description = "Extracts per-query and per-source window features, scores them against the loaded model " +
                    "and classifies the score under the live adaptive thresholds. Returns 503 when no model is loaded.")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody QueryRecord record) {
        if (record.getSubject() == null || record.getSourceKey() == null || record.getSourceKey().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "subject and sourceKey are required"));
        }
        try {
            return ResponseEntity.ok(analysisService.analyze(record));
        } catch (ModelUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Analyse a batch of DNS queries",
            description = "Analyses the queries in order; each one updates its source window before the next is scored. " +
                    "The whole batch is validated first, so a rejected batch changes nothing.")
    @PostMapping("/batch")
    public ResponseEntity<?> analyzeBatch(@RequestBody List<QueryRecord> records) {
        if (records == null || records.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one query is required"));
        }
        try {
            List<AnalysisResult> results = analysisService.analyzeBatch(records);
            return ResponseEntity.ok(Map.of(
                    "count", results.size(),
                    "alerts", results.stream().filter(r -> r.getSeverity().isAlert()).count(),
                    "results", results));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (ModelUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }
}
