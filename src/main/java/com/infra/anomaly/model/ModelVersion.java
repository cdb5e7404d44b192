package com.infra.anomaly.model;

import com.infra.anomaly.engine.isolationforest.FeatureScaler;
import com.infra.anomaly.engine.isolationforest.IsolationForest;
import lombok.Builder;
import lombok.Value;

/**
 * A trained scorer artifact. Instances are immutable: a lifecycle change produces a copy
 * via {@link #withStatus(ModelStatus)}, and the forest, scaler and reference data are
 * never modified after training, so a reference obtained from the active pointer is a
 * consistent snapshot for as long as the reader holds it.
 */
@Value
@Builder(toBuilder = true)
public class ModelVersion {

    String id;
    long sequence;
    IsolationForest forest;
    FeatureScaler scaler;

    /** Scores at or above this value are anomalies. */
    double threshold;

    Hyperparameters hyperparameters;
    int trainedOnCount;

    /** Fraction of validation points flagged with {@link #threshold}; should be close to the contamination. */
    double validationAnomalyRate;

    /** Held-out evaluation; null until the candidate has been evaluated. */
    EvaluationMetrics evaluationMetrics;

    /** Raw (unscaled) feature matrix the model was trained from; the drift reference. */
    double[][] referenceData;

    long createdAt;
    ModelStatus status;

    public double score(double[] rawFeatures) {
        return forest.anomalyScore(scaler.transform(rawFeatures));
    }

    public double[] scoreAll(double[][] rawFeatures) {
        double[] scores = new double[rawFeatures.length];
        for (int i = 0; i < rawFeatures.length; i++) {
            scores[i] = score(rawFeatures[i]);
        }
        return scores;
    }

    public boolean isAnomaly(double score) {
        return score >= threshold;
    }

    public int featureCount() {
        return scaler.getMeans().length;
    }

    public ModelVersion withStatus(ModelStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }
}
