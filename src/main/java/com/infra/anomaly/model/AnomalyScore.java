package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Verdict produced for a single metric sample")
public class AnomalyScore {

    @Schema(description = "Arrival sequence of the sample; scores preserve arrival order", example = "1042")
    long sequence;

    @Schema(description = "Timestamp of the scored sample in epoch milliseconds", example = "1760870400000")
    long sampleTimestamp;

    @Schema(description = "Isolation Forest score in [0, 1]. ~0.5 is normal, close to 1 is anomalous", example = "0.71")
    double rawScore;

    @Schema(description = "True when rawScore is at or above the model's calibrated threshold")
    boolean anomaly;

    @Schema(description = "True once the anomaly verdict has persisted for the configured number of consecutive samples")
    boolean sustained;

    @Schema(description = "Model version that produced the score; null before the first model is promoted",
            example = "v20261019_101500_3", nullable = true)
    String modelVersionId;
}
