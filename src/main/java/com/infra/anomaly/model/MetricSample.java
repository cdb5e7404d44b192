package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "One telemetry observation: a timestamp and a fixed-arity numeric feature vector")
public class MetricSample {

    @With
    @Schema(description = "Observation time in epoch milliseconds", example = "1760870400000")
    long timestamp;

    @Schema(description = "Feature vector in configured feature order (default: cpu_usage, memory_usage, network_load)",
            example = "[42.5, 61.0, 70.2]")
    double[] features;

    @Schema(description = "Optional ground-truth label, used only when evaluating candidate models", nullable = true)
    Boolean label;

    public double[] getFeatures() {
        return features == null ? null : features.clone();
    }

    public int arity() {
        return features == null ? 0 : features.length;
    }

    public double feature(int index) {
        return features[index];
    }
}
