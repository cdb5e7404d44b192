package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.engine.isolationforest.DatasetSplit;
import com.infra.anomaly.engine.isolationforest.FeatureMatrix;
import com.infra.anomaly.engine.isolationforest.FeatureScaler;
import com.infra.anomaly.engine.isolationforest.IsolationForest;
import com.infra.anomaly.exception.DegenerateDataException;
import com.infra.anomaly.exception.InsufficientDataException;
import com.infra.anomaly.model.Hyperparameters;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.model.ModelStatus;
import com.infra.anomaly.model.ModelVersion;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Trains a candidate model from a snapshot of the feature window.
 *
 * Flow:
 * 1. Reject snapshots that are too small or have no variance in any feature
 * 2. Split into train / validation / test with a fixed seed
 * 3. Fit the scaler and the forest on the train split
 * 4. Set the verdict threshold so that the contamination fraction of validation points is flagged
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final AnomalyConfig config;

    public ModelTrainingService(AnomalyConfig config) {
        this.config = config;
    }

    /**
     * @throws InsufficientDataException if the snapshot has fewer than the configured minimum samples
     * @throws DegenerateDataException   if every feature is constant across the snapshot
     */
    @Observed(name = "model.train", contextualName = "train-model")
    public TrainingResult train(List<MetricSample> snapshot) {
        AnomalyConfig.Training training = config.getTraining();
        int minSamples = training.getMinSamples();
        if (snapshot.size() < minSamples) {
            throw new InsufficientDataException("training", snapshot.size(), minSamples);
        }

        double[][] data = FeatureMatrix.of(snapshot);
        if (!FeatureMatrix.hasVariance(data)) {
            throw new DegenerateDataException(String.format(
                    "All %d features are constant across %d samples", data[0].length, data.length));
        }

        Boolean[] labels = new Boolean[snapshot.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = snapshot.get(i).getLabel();
        }

        long seed = training.getRandomSeed();
        DatasetSplit split = DatasetSplit.of(data, labels,
                training.getValidationFraction(), training.getTestFraction(), seed);

        log.info("Training model on {} samples (train={}, validation={}, test={})",
                data.length, split.train().length, split.validation().length, split.test().length);

        FeatureScaler scaler = FeatureScaler.fit(split.train());
        IsolationForest forest = new IsolationForest();
        forest.train(scaler.transform(split.train()), config.getTreeCount(), config.getSubSampleSize(), seed);

        // Calibrate on validation; fall back to the train split when no validation rows were held out
        double[][] calibration = split.validation().length > 0 ? split.validation() : split.train();
        double[] calibrationScores = forest.anomalyScores(scaler.transform(calibration));
        double threshold = calibrateThreshold(calibrationScores, config.getContamination());
        double anomalyRate = flaggedFraction(calibrationScores, threshold);

        ModelVersion model = ModelVersion.builder()
                .forest(forest)
                .scaler(scaler)
                .threshold(threshold)
                .hyperparameters(Hyperparameters.builder()
                        .contamination(config.getContamination())
                        .treeCount(config.getTreeCount())
                        .subSampleSize(forest.getSampleSize())
                        .randomSeed(seed)
                        .build())
                .trainedOnCount(split.train().length)
                .validationAnomalyRate(anomalyRate)
                .referenceData(data)
                .status(ModelStatus.CANDIDATE)
                .build();

        log.info("Trained model: {} trees, subSample={}, maxDepth={}, threshold={}, validationAnomalyRate={}",
                forest.getTreeCount(), forest.getSampleSize(), forest.getMaxTreeDepth(),
                String.format("%.4f", threshold), String.format("%.4f", anomalyRate));

        return new TrainingResult(model, split.test(), split.testLabels());
    }

    /**
     * The k-th highest score, k = max(1, round(contamination * n)). Scores at or above it are anomalies.
     */
    static double calibrateThreshold(double[] scores, double contamination) {
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        int k = Math.max(1, (int) Math.round(contamination * sorted.length));
        k = Math.min(k, sorted.length);
        return sorted[sorted.length - k];
    }

    static double flaggedFraction(double[] scores, double threshold) {
        int flagged = 0;
        for (double score : scores) {
            if (score >= threshold) flagged++;
        }
        return scores.length == 0 ? 0.0 : (double) flagged / scores.length;
    }
}
