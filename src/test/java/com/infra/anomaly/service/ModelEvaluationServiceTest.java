package com.infra.anomaly.service;

import com.infra.anomaly.model.EvaluationMetrics;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.ScoreComparison;
import com.infra.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelEvaluationServiceTest {

    private static TrainingResult training;
    private static ModelVersion other;

    private ModelEvaluationService evaluationService;

    @BeforeAll
    static void trainModels() {
        training = new ModelTrainingService(TestDataFactory.testConfig())
                .train(TestDataFactory.normalSamples(400, 13));
        other = TestDataFactory.trainedModel(400, 14);
    }

    @BeforeEach
    void setUp() {
        evaluationService = new ModelEvaluationService();
    }

    @Test
    void evaluateCandidate_noIncumbent_candidateMetricsOnly() {
        EvaluationMetrics metrics = evaluationService.evaluateCandidate(
                training.model(), null, training.heldOut(), null);

        assertThat(metrics.getHeldOutCount()).isEqualTo(training.heldOut().length);
        assertThat(metrics.isLabelled()).isFalse();
        assertThat(metrics.getIncumbentF1()).isNull();
        assertThat(metrics.getScoreCorrelation()).isNull();
        assertThat(metrics.getF1()).isBetween(0.0, 1.0);
    }

    @Test
    void evaluateCandidate_incumbentIsSameModel_identicalF1AndPerfectCorrelation() {
        EvaluationMetrics metrics = evaluationService.evaluateCandidate(
                training.model(), training.model(), training.heldOut(), null);

        assertThat(metrics.getIncumbentF1()).isEqualTo(metrics.getF1());
        assertThat(metrics.getScoreCorrelation()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getMeanScoreDelta()).isEqualTo(0.0);
    }

    @Test
    void evaluateCandidate_differentIncumbent_bothMeasuredOnSameRows() {
        EvaluationMetrics metrics = evaluationService.evaluateCandidate(
                training.model(), other, training.heldOut(), null);

        assertThat(metrics.getIncumbentF1()).isNotNull().isBetween(0.0, 1.0);
        assertThat(metrics.getScoreCorrelation()).isNotNull();
        assertThat(metrics.getMeanScoreDelta()).isGreaterThan(0.0);
    }

    @Test
    void evaluateCandidate_withLabels_usesLabelsAsTruth() {
        Boolean[] allAnomalous = new Boolean[training.heldOut().length];
        Arrays.fill(allAnomalous, Boolean.TRUE);

        EvaluationMetrics metrics = evaluationService.evaluateCandidate(
                training.model(), null, training.heldOut(), allAnomalous);

        assertThat(metrics.isLabelled()).isTrue();
        assertThat(metrics.getRecall())
                .isCloseTo((double) metrics.getFlaggedCount() / metrics.getHeldOutCount(), within(1e-12));
        if (metrics.getFlaggedCount() > 0) {
            assertThat(metrics.getPrecision()).isEqualTo(1.0);
        }
    }

    @Test
    void evaluate_countsTruePositivesAgainstThreshold() {
        ModelVersion model = ModelVersion.builder().threshold(0.6).build();
        double[] scores = {0.9, 0.7, 0.65, 0.3, 0.2};
        boolean[] truth = {true, true, false, true, false};

        EvaluationMetrics metrics = evaluationService.evaluate(model, scores, truth, true);

        // predicted: 0.9, 0.7, 0.65 -> tp=2, fp=1, fn=1
        assertThat(metrics.getPrecision()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(metrics.getRecall()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(metrics.getF1()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(metrics.getFlaggedCount()).isEqualTo(3);
    }

    @Test
    void evaluate_nothingFlagged_zeroScoresWithoutDivisionByZero() {
        ModelVersion model = ModelVersion.builder().threshold(0.99).build();

        EvaluationMetrics metrics = evaluationService.evaluate(
                model, new double[]{0.1, 0.2}, new boolean[]{false, false}, false);

        assertThat(metrics.getPrecision()).isEqualTo(0.0);
        assertThat(metrics.getRecall()).isEqualTo(0.0);
        assertThat(metrics.getF1()).isEqualTo(0.0);
    }

    @Test
    void topFraction_marksHighestScores() {
        double[] scores = {0.1, 0.9, 0.5, 0.7};

        assertThat(ModelEvaluationService.topFraction(scores, 0.5)).containsExactly(false, true, false, true);
        assertThat(ModelEvaluationService.topFraction(scores, 0.01)).containsExactly(false, true, false, false);
        assertThat(ModelEvaluationService.topFraction(new double[0], 0.5)).isEmpty();
    }

    @Test
    void compare_constantScores_correlationIsNull() {
        ScoreComparison comparison = evaluationService.compare(
                new double[]{0.5, 0.5, 0.5}, new double[]{0.1, 0.4, 0.7});

        assertThat(comparison.getSpearmanCorrelation()).isNull();
        assertThat(comparison.getMeanAbsoluteDelta()).isCloseTo(0.7 / 3.0, within(1e-12));
    }
}
