package com.infra.anomaly.controller;

import com.infra.anomaly.exception.ModelVersionNotFoundException;
import com.infra.anomaly.model.CycleOutcome;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.ModelVersionSummary;
import com.infra.anomaly.registry.ModelVersionStore;
import com.infra.anomaly.service.RetrainOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Model version registry, manual retraining and rollback")
public class ModelController {

    private final ModelVersionStore store;
    private final RetrainOrchestrator orchestrator;

    public ModelController(ModelVersionStore store, RetrainOrchestrator orchestrator) {
        this.store = store;
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "List model versions",
            description = "Every registered version, oldest first. Versions are never deleted.")
    @GetMapping
    public ResponseEntity<List<ModelVersionSummary>> listVersions() {
        List<ModelVersionSummary> versions = store.list().stream()
                .map(ModelVersionSummary::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(versions);
    }

    @Operation(summary = "Get the active model",
            description = "Returns 404 until the first model has been promoted.")
    @GetMapping("/active")
    public ResponseEntity<ModelVersionSummary> getActive() {
        ModelVersion active = store.getActive();
        if (active == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ModelVersionSummary.from(active));
    }

    @Operation(summary = "Get a model version")
    @GetMapping("/{versionId}")
    public ResponseEntity<ModelVersionSummary> getVersion(
            @Parameter(description = "Model version ID", example = "v20261019_101500_3")
            @PathVariable String versionId) {
        return store.find(versionId)
                .map(version -> ResponseEntity.ok(ModelVersionSummary.from(version)))
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Retrain now",
            description = "Trains a candidate from the current window, evaluates it against the active model and " +
                    "promotes it if it passes the F1 gate. Blocks until the attempt finishes or times out.")
    @PostMapping("/retrain")
    public ResponseEntity<CycleOutcome> retrain() {
        return ResponseEntity.ok(orchestrator.retrainNow());
    }

    @Operation(summary = "Roll back to a model version",
            description = "Makes an earlier version active again. The current active version is retired.")
    @PostMapping("/{versionId}/rollback")
    public ResponseEntity<?> rollback(
            @Parameter(description = "Model version ID to reactivate", example = "v20261019_101500_2")
            @PathVariable String versionId) {
        try {
            ModelVersion active = store.rollback(versionId);
            return ResponseEntity.ok(ModelVersionSummary.from(active));
        } catch (ModelVersionNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }
}
