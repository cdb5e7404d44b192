package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of one drift test across all features")
public class DriftTestResult {

    @Schema(description = "Test that produced this result", example = "WASSERSTEIN")
    DriftTestType testType;

    @Schema(description = "Largest per-feature statistic", example = "0.42")
    double statistic;

    @Schema(description = "True when at least one feature crossed the test's threshold")
    boolean drifted;

    @Schema(description = "Per-feature statistics in feature order")
    List<Double> featureStatistics;
}
