package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "A sample the active model flagged as anomalous")
public class DetectedAnomaly {

    long sequence;

    @Schema(description = "Sample timestamp in epoch milliseconds")
    long timestamp;

    @Schema(description = "Feature values keyed by feature name")
    Map<String, Double> features;

    double rawScore;

    @Schema(description = "True once the anomaly has persisted for the configured number of consecutive samples")
    boolean sustained;

    String modelVersionId;
}
