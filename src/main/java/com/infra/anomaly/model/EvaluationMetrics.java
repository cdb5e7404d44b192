package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Held-out evaluation of a model, optionally compared with the incumbent on the same points")
public class EvaluationMetrics {

    double precision;
    double recall;
    double f1;

    @Schema(description = "Number of held-out points evaluated")
    int heldOutCount;

    @Schema(description = "Number of held-out points the model flagged")
    int flaggedCount;

    @Schema(description = "True when held-out ground truth came from sample labels rather than score ranking")
    boolean labelled;

    @Schema(description = "Incumbent F1 on the same held-out points", nullable = true)
    Double incumbentF1;

    @Schema(description = "Spearman rank correlation between candidate and incumbent scores", nullable = true)
    Double scoreCorrelation;

    @Schema(description = "Mean absolute difference between candidate and incumbent scores", nullable = true)
    Double meanScoreDelta;
}
