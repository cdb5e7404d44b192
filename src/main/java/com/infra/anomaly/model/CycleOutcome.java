package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "What one orchestrator cycle did")
public class CycleOutcome {

    @Schema(example = "17")
    long cycleId;

    @Schema(description = "Trigger that started training; null when the cycle was skipped", nullable = true)
    RetrainTrigger trigger;

    @Schema(example = "PROMOTED")
    CycleResult result;

    @Schema(description = "Drift check that ran at the start of the cycle; null for manual retrains", nullable = true)
    DriftReport driftReport;

    @Schema(description = "Candidate produced by this cycle", nullable = true)
    String candidateVersionId;

    @Schema(description = "Active model after the cycle", nullable = true)
    String activeVersionId;

    @Schema(example = "candidate F1 0.4000 < incumbent F1 0.9000 - tolerance 0.02")
    String reason;

    long startedAt;

    long finishedAt;
}
