package com.infra.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Per-feature standardization, z = (x - mean) / std, fitted on the training split.
 * A feature with zero spread is scaled with std 1 so it maps to a constant instead of NaN.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureScaler {

    private double[] means;
    private double[] stds;

    public FeatureScaler() {}

    public FeatureScaler(double[] means, double[] stds) {
        this.means = means;
        this.stds = stds;
    }

    public static FeatureScaler fit(double[][] data) {
        int featureCount = data[0].length;
        double[] means = new double[featureCount];
        double[] stds = new double[featureCount];
        // Population std, matching the usual StandardScaler convention
        StandardDeviation std = new StandardDeviation(false);
        Mean mean = new Mean();
        for (int f = 0; f < featureCount; f++) {
            double[] column = FeatureMatrix.column(data, f);
            means[f] = mean.evaluate(column);
            double s = std.evaluate(column);
            stds[f] = s > 0 ? s : 1.0;
        }
        return new FeatureScaler(means, stds);
    }

    public double[] transform(double[] point) {
        double[] scaled = new double[point.length];
        for (int f = 0; f < point.length; f++) {
            scaled[f] = (point[f] - means[f]) / stds[f];
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }

    public double[] getMeans() { return means; }
    public void setMeans(double[] means) { this.means = means; }
    public double[] getStds() { return stds; }
    public void setStds(double[] stds) { this.stds = stds; }
}
