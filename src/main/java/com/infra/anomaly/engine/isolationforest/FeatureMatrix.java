package com.infra.anomaly.engine.isolationforest;

import com.infra.anomaly.model.MetricSample;

import java.util.List;

public final class FeatureMatrix {

    private FeatureMatrix() {}

    public static double[][] of(List<MetricSample> samples) {
        double[][] matrix = new double[samples.size()][];
        for (int i = 0; i < samples.size(); i++) {
            matrix[i] = samples.get(i).getFeatures();
        }
        return matrix;
    }

    public static double[] column(double[][] data, int feature) {
        double[] column = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            column[i] = data[i][feature];
        }
        return column;
    }

    /**
     * True if at least one feature takes more than one distinct value.
     */
    public static boolean hasVariance(double[][] data) {
        if (data.length < 2) return false;
        int featureCount = data[0].length;
        for (int f = 0; f < featureCount; f++) {
            double first = data[0][f];
            for (int i = 1; i < data.length; i++) {
                if (data[i][f] != first) return true;
            }
        }
        return false;
    }
}
