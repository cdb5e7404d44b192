package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "Result of one drift-check cycle comparing the recent window with the active model's reference")
public class DriftReport {

    @Schema(description = "Check time in epoch milliseconds", example = "1760870400000")
    long timestamp;

    @Schema(description = "DRIFT, NO_DRIFT or INSUFFICIENT_DATA", example = "NO_DRIFT")
    DriftStatus status;

    @Schema(description = "Per-test results keyed by test name")
    Map<DriftTestType, DriftTestResult> testResults;

    @Schema(description = "Number of tests voting drifted", example = "1")
    int votes;

    @Schema(description = "True when votes reached the consensus threshold")
    boolean consensus;

    @Schema(description = "Fraction of tests voting drifted", example = "0.2")
    double confidence;

    @Schema(description = "Reference sample count", example = "2000")
    int referenceSize;

    @Schema(description = "Recent sample count", example = "200")
    int recentSize;

    @Schema(description = "Active model whose reference was used", nullable = true)
    String modelVersionId;

    @Schema(description = "Why the check could not reach a verdict", nullable = true)
    String reason;
}
