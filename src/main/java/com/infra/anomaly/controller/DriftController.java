package com.infra.anomaly.controller;

import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.service.DriftDetectionService;
import com.infra.anomaly.service.RecordHistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/drift")
@Tag(name = "Drift", description = "Run drift checks and inspect drift reports")
public class DriftController {

    private final DriftDetectionService driftDetectionService;
    private final RecordHistoryService historyService;

    public DriftController(DriftDetectionService driftDetectionService,
                           RecordHistoryService historyService) {
        this.driftDetectionService = driftDetectionService;
        this.historyService = historyService;
    }

    @Operation(summary = "Run a drift check",
            description = "Compares the newest window samples with the active model's training data using five tests " +
                    "(Kolmogorov-Smirnov, Wasserstein, Anderson-Darling, Jensen-Shannon, mean shift). " +
                    "Does not start retraining.")
    @PostMapping("/check")
    public ResponseEntity<DriftReport> check() {
        return ResponseEntity.ok(driftDetectionService.checkDrift());
    }

    @Operation(summary = "Latest drift report")
    @GetMapping("/latest")
    public ResponseEntity<DriftReport> latest() {
        DriftReport report = historyService.latestDriftReport();
        if (report == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Drift report history", description = "Most recent reports, newest first.")
    @GetMapping("/history")
    public ResponseEntity<List<DriftReport>> history(
            @Parameter(description = "Maximum number of reports", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(historyService.driftHistory(limit));
    }
}
