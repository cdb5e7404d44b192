package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Structured record of one retrain orchestrator state transition")
public class StateTransitionEvent {

    @Schema(description = "Retrain cycle that produced this transition", example = "17")
    long cycleId;

    @Schema(example = "IDLE")
    OrchestratorState fromState;

    @Schema(example = "TRAINING")
    OrchestratorState toState;

    @Schema(example = "DRIFT: consensus 4/5 (confidence 0.80)")
    String reason;

    @Schema(description = "Candidate or active model involved in the transition", nullable = true)
    String modelVersionId;

    @Schema(description = "Transition time in epoch milliseconds")
    long timestamp;
}
