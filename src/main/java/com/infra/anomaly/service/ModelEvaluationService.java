package com.infra.anomaly.service;

import com.infra.anomaly.model.EvaluationMetrics;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.ScoreComparison;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Scores candidate and incumbent on the same held-out rows and computes precision, recall
 * and F1 for each.
 *
 * When the held-out rows carry no labels, ground truth is the top contamination fraction of
 * rows ranked by the candidate's score. Both models are measured against that same truth.
 */
@Service
public class ModelEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    /**
     * @param incumbent currently active model, or null on the first promotion
     * @param labels    ground truth for {@code heldOut}, or null to derive it from the candidate's ranking
     * @return candidate metrics, with the incumbent's F1 and the score comparison filled in when there is one
     */
    public EvaluationMetrics evaluateCandidate(ModelVersion candidate, ModelVersion incumbent,
                                               double[][] heldOut, Boolean[] labels) {
        double[] candidateScores = candidate.scoreAll(heldOut);
        boolean labelled = labels != null;
        boolean[] truth = labelled
                ? unbox(labels)
                : topFraction(candidateScores, candidate.getHyperparameters().getContamination());

        EvaluationMetrics metrics = evaluate(candidate, candidateScores, truth, labelled);
        if (incumbent == null) {
            log.info("Evaluated candidate without incumbent: precision={}, recall={}, f1={}, labelled={}",
                    fmt(metrics.getPrecision()), fmt(metrics.getRecall()), fmt(metrics.getF1()), labelled);
            return metrics;
        }

        double[] incumbentScores = incumbent.scoreAll(heldOut);
        EvaluationMetrics incumbentMetrics = evaluate(incumbent, incumbentScores, truth, labelled);
        ScoreComparison comparison = compare(candidateScores, incumbentScores);

        log.info("Evaluated candidate vs incumbent {}: candidateF1={}, incumbentF1={}, spearman={}, meanDelta={}",
                incumbent.getId(), fmt(metrics.getF1()), fmt(incumbentMetrics.getF1()),
                comparison.getSpearmanCorrelation(), fmt(comparison.getMeanAbsoluteDelta()));

        return metrics.toBuilder()
                .incumbentF1(incumbentMetrics.getF1())
                .scoreCorrelation(comparison.getSpearmanCorrelation())
                .meanScoreDelta(comparison.getMeanAbsoluteDelta())
                .build();
    }

    EvaluationMetrics evaluate(ModelVersion model, double[] scores, boolean[] truth, boolean labelled) {
        int tp = 0;
        int fp = 0;
        int fn = 0;
        int flagged = 0;
        for (int i = 0; i < scores.length; i++) {
            boolean predicted = model.isAnomaly(scores[i]);
            if (predicted) flagged++;
            if (predicted && truth[i]) tp++;
            else if (predicted) fp++;
            else if (truth[i]) fn++;
        }

        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);

        return EvaluationMetrics.builder()
                .precision(precision)
                .recall(recall)
                .f1(f1)
                .heldOutCount(scores.length)
                .flaggedCount(flagged)
                .labelled(labelled)
                .build();
    }

    /**
     * Spearman rank correlation (null when either side is constant) and mean absolute score difference.
     */
    public ScoreComparison compare(double[] candidateScores, double[] incumbentScores) {
        double delta = 0.0;
        for (int i = 0; i < candidateScores.length; i++) {
            delta += Math.abs(candidateScores[i] - incumbentScores[i]);
        }
        delta = candidateScores.length == 0 ? 0.0 : delta / candidateScores.length;

        Double correlation = null;
        if (candidateScores.length >= 2) {
            double rho = new SpearmansCorrelation().correlation(candidateScores, incumbentScores);
            if (!Double.isNaN(rho)) {
                correlation = rho;
            }
        }
        return new ScoreComparison(correlation, delta);
    }

    /**
     * Marks the int(n * fraction) highest-scoring rows, at least one, as positives.
     */
    static boolean[] topFraction(double[] scores, double fraction) {
        int n = scores.length;
        boolean[] truth = new boolean[n];
        if (n == 0) return truth;
        int count = Math.min(n, Math.max(1, (int) (n * fraction)));
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());
        for (int i = 0; i < count; i++) {
            truth[order[i]] = true;
        }
        return truth;
    }

    private static boolean[] unbox(Boolean[] labels) {
        boolean[] out = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) {
            out[i] = Boolean.TRUE.equals(labels[i]);
        }
        return out;
    }

    private static String fmt(double value) {
        return String.format("%.4f", value);
    }
}
