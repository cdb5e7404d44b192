package com.infra.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Grows one tree over {@code data}. Rows are never copied: recursion works on a
     * shared index array that each level partitions in place.
     */
    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        int[] rows = new int[data.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return new IsolationTree(grow(data, rows, 0, rows.length, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] data, int[] rows, int from, int to,
                                      int depth, int maxDepth, Random random) {
        int size = to - from;
        if (size <= 1 || depth >= maxDepth) {
            return IsolationNode.externalNode(size);
        }

        int featureCount = data[rows[from]].length;
        double[][] ranges = new double[featureCount][];
        int[] candidates = new int[featureCount];
        int candidateCount = 0;
        for (int feature = 0; feature < featureCount; feature++) {
            double[] range = columnRange(data, rows, from, to, feature);
            ranges[feature] = range;
            if (range[0] < range[1]) {
                candidates[candidateCount++] = feature;
            }
        }

        // every remaining row is the same point
        if (candidateCount == 0) {
            return IsolationNode.externalNode(size);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double low = ranges[feature][0];
        double high = ranges[feature][1];
        double cut = low + random.nextDouble() * (high - low);

        int boundary = partition(data, rows, from, to, feature, cut);
        return IsolationNode.internalNode(feature, cut,
                grow(data, rows, from, boundary, depth + 1, maxDepth, random),
                grow(data, rows, boundary, to, depth + 1, maxDepth, random));
    }

    private static double[] columnRange(double[][] data, int[] rows, int from, int to, int feature) {
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double value = data[rows[i]][feature];
            low = Math.min(low, value);
            high = Math.max(high, value);
        }
        return new double[]{low, high};
    }

    /** Moves rows below {@code cut} to the front of the range and returns the first index of the rest. */
    private static int partition(double[][] data, int[] rows, int from, int to, int feature, double cut) {
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][feature] < cut) {
                int swap = rows[boundary];
                rows[boundary] = rows[i];
                rows[i] = swap;
                boundary++;
            }
        }
        return boundary;
    }

    public double pathLength(double[] point) {
        return root.pathLength(point);
    }

    @JsonIgnore
    public int getDepth() {
        return root.depth();
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
