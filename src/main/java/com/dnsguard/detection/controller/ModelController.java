package com.dnsguard.detection.controller;

import com.dnsguard.detection.engine.artifact.ModelArtifactException;
import com.dnsguard.detection.engine.scoring.ModelUnavailableException;
import com.dnsguard.detection.model.ModelMetadata;
import com.dnsguard.detection.model.QueryRecord;
import com.dnsguard.detection.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Outlier model training, metadata and artifact import/export")
public class ModelController {

    private final ModelTrainingService trainingService;

    public ModelController(ModelTrainingService trainingService) {
        this.trainingService = trainingService;
    }

    @Operation(summary = "Train the model on baseline traffic",
            description = "Fits a new Random Cut Forest on the features of the given benign queries and rebuilds " +
                    "the baseline score calibration. The new model replaces the current one atomically.")
    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody List<QueryRecord> baseline) {
        try {
            return ResponseEntity.ok(trainingService.train(baseline));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get model metadata",
            description = "Returns the model type, training sample count, install time and baseline calibration.")
    @GetMapping
    public ResponseEntity<ModelMetadata> getMetadata() {
        ModelMetadata metadata = trainingService.getMetadata();
        if (metadata == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metadata);
    }

    @Operation(summary = "Export the model artifact",
            description = "Returns the current versioned artifact: model state, baseline calibration and live thresholds.")
    @GetMapping(value = "/artifact", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> exportArtifact() {
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(trainingService.exportArtifact());
        } catch (ModelUnavailableException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Import a model artifact",
            description = "Loads an artifact of any supported schema version (legacy versions are upgraded on load) " +
                    "and installs its model and calibration.")
    @PutMapping(value = "/artifact", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> importArtifact(@RequestBody byte[] artifact) {
        try {
            return ResponseEntity.ok(trainingService.importArtifact(artifact));
        } catch (ModelArtifactException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
