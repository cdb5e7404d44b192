package com.infra.anomaly.controller;

import com.infra.anomaly.exception.InvalidSampleException;
import com.infra.anomaly.model.AnomalyScore;
import com.infra.anomaly.model.DetectedAnomaly;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.service.RecordHistoryService;
import com.infra.anomaly.service.TelemetryIngestionService;
import com.infra.anomaly.window.FeatureWindow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/telemetry")
@Tag(name = "Telemetry", description = "Submit metric samples for scoring and inspect the feature window")
public class TelemetryController {

    private final TelemetryIngestionService ingestionService;
    private final RecordHistoryService historyService;
    private final FeatureWindow window;

    public TelemetryController(TelemetryIngestionService ingestionService,
                               RecordHistoryService historyService,
                               FeatureWindow window) {
        this.ingestionService = ingestionService;
        this.historyService = historyService;
        this.window = window;
    }

    @Operation(summary = "Score a metric sample",
            description = "Validates the sample, appends it to the feature window and scores it with the active model. " +
                    "Before the first model is promoted every sample scores 0 and is not anomalous.")
    @PostMapping("/samples")
    public ResponseEntity<?> ingest(@RequestBody MetricSample sample) {
        try {
            AnomalyScore score = ingestionService.ingest(sample);
            return ResponseEntity.ok(score);
        } catch (InvalidSampleException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid metric sample",
                    "issues", e.getIssues()));
        }
    }

    @Operation(summary = "Score a batch of metric samples",
            description = "Validates every sample first; if any is invalid nothing is stored. " +
                    "Valid batches are ingested in order and one score is returned per sample.")
    @PostMapping("/samples/batch")
    public ResponseEntity<?> ingestBatch(@RequestBody List<MetricSample> samples) {
        try {
            List<AnomalyScore> scores = ingestionService.ingestBatch(samples);
            return ResponseEntity.ok(scores);
        } catch (InvalidSampleException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid metric sample batch",
                    "issues", e.getIssues()));
        }
    }

    @Operation(summary = "Feature window summary",
            description = "Current size, capacity and time span of the feature window, plus ingestion counters.")
    @GetMapping("/window")
    public ResponseEntity<Map<String, Object>> getWindow() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("size", window.size());
        summary.put("capacity", window.getCapacity());
        summary.put("oldestTimestamp", window.getOldestTimestamp());
        summary.put("newestTimestamp", window.getNewestTimestamp());
        summary.put("appendedCount", window.getAppendedCount());
        summary.put("droppedOutOfOrderCount", window.getDroppedCount());
        summary.put("ingestedCount", ingestionService.getIngestedCount());
        return ResponseEntity.ok(summary);
    }

    @Operation(summary = "Recent anomaly scores",
            description = "Most recent per-sample scores, newest first, anomalous or not.")
    @GetMapping("/scores")
    public ResponseEntity<List<AnomalyScore>> getScores(
            @Parameter(description = "Maximum number of scores to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(historyService.recentScores(limit));
    }

    @Operation(summary = "Recently detected anomalies",
            description = "Most recent anomalous samples, newest first.")
    @GetMapping("/anomalies")
    public ResponseEntity<List<DetectedAnomaly>> getAnomalies(
            @Parameter(description = "Maximum number of anomalies to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(historyService.detectedAnomalies(limit));
    }
}
