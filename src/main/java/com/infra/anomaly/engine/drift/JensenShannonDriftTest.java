package com.infra.anomaly.engine.drift;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.model.DriftTestType;
import org.springframework.stereotype.Component;

/**
 * Jensen-Shannon divergence (base 2, so bounded by 1) between histograms of the two samples
 * over shared equal-width bins spanning their combined range.
 */
@Component
public class JensenShannonDriftTest extends AbstractFeatureDriftTest {

    private final AnomalyConfig config;

    public JensenShannonDriftTest(AnomalyConfig config) {
        this.config = config;
    }

    @Override
    public DriftTestType getType() {
        return DriftTestType.JENSEN_SHANNON;
    }

    @Override
    protected FeatureComparison compare(double[] reference, double[] recent) {
        double divergence = divergence(reference, recent, config.getDrift().getJensenShannonBins());
        return new FeatureComparison(divergence, divergence > config.getDrift().getJensenShannonThreshold());
    }

    static double divergence(double[] reference, double[] recent, int bins) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : reference) { min = Math.min(min, x); max = Math.max(max, x); }
        for (double x : recent) { min = Math.min(min, x); max = Math.max(max, x); }
        if (max <= min) {
            // Every value identical: both histograms are a single spike in the same place
            return 0.0;
        }

        double[] p = histogram(reference, min, max, bins);
        double[] q = histogram(recent, min, max, bins);

        double js = 0.0;
        for (int b = 0; b < bins; b++) {
            double m = 0.5 * (p[b] + q[b]);
            if (p[b] > 0) js += 0.5 * p[b] * log2(p[b] / m);
            if (q[b] > 0) js += 0.5 * q[b] * log2(q[b] / m);
        }
        // Rounding can push an identical pair a hair below zero
        return Math.max(0.0, js);
    }

    private static double[] histogram(double[] values, double min, double max, int bins) {
        double[] mass = new double[bins];
        double width = (max - min) / bins;
        for (double x : values) {
            int bin = (int) ((x - min) / width);
            if (bin >= bins) bin = bins - 1;
            mass[bin] += 1.0;
        }
        for (int b = 0; b < bins; b++) {
            mass[b] /= values.length;
        }
        return mass;
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
