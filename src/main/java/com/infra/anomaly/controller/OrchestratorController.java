package com.infra.anomaly.controller;

import com.infra.anomaly.model.CycleOutcome;
import com.infra.anomaly.model.OrchestratorStatus;
import com.infra.anomaly.model.StateTransitionEvent;
import com.infra.anomaly.service.RecordHistoryService;
import com.infra.anomaly.service.RetrainOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/orchestrator")
@Tag(name = "Orchestrator", description = "Retrain state machine status and transition log")
public class OrchestratorController {

    private final RetrainOrchestrator orchestrator;
    private final RecordHistoryService historyService;

    public OrchestratorController(RetrainOrchestrator orchestrator, RecordHistoryService historyService) {
        this.orchestrator = orchestrator;
        this.historyService = historyService;
    }

    @Operation(summary = "Orchestrator status",
            description = "Current state, active model, timer schedule and the outcome of the last cycle.")
    @GetMapping("/state")
    public ResponseEntity<OrchestratorStatus> getState() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }

    @Operation(summary = "State transition log", description = "Most recent transitions, newest first.")
    @GetMapping("/events")
    public ResponseEntity<List<StateTransitionEvent>> getEvents(
            @Parameter(description = "Maximum number of events", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(historyService.transitionHistory(limit));
    }

    @Operation(summary = "Run one cycle now",
            description = "Runs a drift check and, if a trigger fires, one training attempt, without waiting for the scheduler.")
    @PostMapping("/cycle")
    public ResponseEntity<CycleOutcome> runCycle() {
        return ResponseEntity.ok(orchestrator.runCycle());
    }
}
