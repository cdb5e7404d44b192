package com.infra.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Model version metadata without the serialized forest or reference data")
public class ModelVersionSummary {

    @Schema(example = "v20261019_101500_3")
    String id;

    long sequence;

    @Schema(example = "ACTIVE")
    ModelStatus status;

    @Schema(description = "Scores at or above this value are anomalies", example = "0.62")
    double threshold;

    Hyperparameters hyperparameters;

    int trainedOnCount;

    double validationAnomalyRate;

    @Schema(nullable = true)
    EvaluationMetrics evaluationMetrics;

    int treeCount;

    int maxTreeDepth;

    int featureCount;

    @Schema(description = "Rows in the drift reference distribution")
    int referenceSize;

    long createdAt;

    public static ModelVersionSummary from(ModelVersion version) {
        return ModelVersionSummary.builder()
                .id(version.getId())
                .sequence(version.getSequence())
                .status(version.getStatus())
                .threshold(version.getThreshold())
                .hyperparameters(version.getHyperparameters())
                .trainedOnCount(version.getTrainedOnCount())
                .validationAnomalyRate(version.getValidationAnomalyRate())
                .evaluationMetrics(version.getEvaluationMetrics())
                .treeCount(version.getForest().getTreeCount())
                .maxTreeDepth(version.getForest().getMaxTreeDepth())
                .featureCount(version.featureCount())
                .referenceSize(version.getReferenceData() == null ? 0 : version.getReferenceData().length)
                .createdAt(version.getCreatedAt())
                .build();
    }
}
