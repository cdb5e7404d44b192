package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Current retrain orchestrator state")
public class OrchestratorStatus {

    @Schema(example = "IDLE")
    OrchestratorState state;

    boolean enabled;

    @Schema(nullable = true)
    String activeVersionId;

    @Schema(description = "Number of cycles run since startup")
    long cycleCount;

    @Schema(description = "Start of the most recent training attempt in epoch milliseconds", nullable = true)
    Long lastAttemptAt;

    @Schema(description = "Earliest time the timer trigger fires, in epoch milliseconds")
    long nextTimerAt;

    @Schema(nullable = true)
    CycleOutcome lastOutcome;

    int windowSize;
}
