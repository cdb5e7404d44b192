package com.infra.anomaly.engine.isolationforest;

import java.util.Random;

/**
 * Seeded train/validation/test partition of a reference window. The held-out share is
 * sized first and then divided between validation and test, test taking the odd row.
 */
public final class DatasetSplit {

    private final double[][] train;
    private final double[][] validation;
    private final double[][] test;
    private final Boolean[] testLabels;

    private DatasetSplit(double[][] train, double[][] validation, double[][] test, Boolean[] testLabels) {
        this.train = train;
        this.validation = validation;
        this.test = test;
        this.testLabels = testLabels;
    }

    /**
     * @param labels optional per-row labels (may be null or contain nulls); carried for the test rows
     */
    public static DatasetSplit of(double[][] data, Boolean[] labels,
                                  double validationFraction, double testFraction, long seed) {
        int n = data.length;
        // Small epsilon keeps e.g. 0.3 * 500 from rounding up to 151
        int heldOut = (int) Math.ceil((validationFraction + testFraction) * n - 1e-9);
        heldOut = Math.min(heldOut, n - 1);
        int testCount = (heldOut + 1) / 2;
        int validationCount = heldOut - testCount;
        int trainCount = n - heldOut;

        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Random random = new Random(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }

        double[][] train = new double[trainCount][];
        double[][] validation = new double[validationCount][];
        double[][] test = new double[testCount][];
        Boolean[] testLabels = new Boolean[testCount];

        for (int i = 0; i < trainCount; i++) {
            train[i] = data[order[i]];
        }
        for (int i = 0; i < validationCount; i++) {
            validation[i] = data[order[trainCount + i]];
        }
        for (int i = 0; i < testCount; i++) {
            int row = order[trainCount + validationCount + i];
            test[i] = data[row];
            testLabels[i] = labels == null ? null : labels[row];
        }
        return new DatasetSplit(train, validation, test, testLabels);
    }

    public double[][] train() { return train; }
    public double[][] validation() { return validation; }
    public double[][] test() { return test; }

    /**
     * Test-row labels, or null unless every test row is labelled.
     */
    public Boolean[] testLabels() {
        for (Boolean label : testLabels) {
            if (label == null) return null;
        }
        return testLabels;
    }
}
