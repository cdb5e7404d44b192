package com.infra.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Ensemble of isolation trees (Liu, Ting and Zhou, 2008).
 *
 * A trained forest is never modified again; it is shared read-only between the
 * inference path and evaluation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sampling size per tree; the effective size is min(sampleSize, N)
     * @param seed       random seed; the same data and seed always yield the same forest
     * @throws CancellationException if the training thread is interrupted between trees
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty data set");
        }
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));
        Random random = new Random(seed);
        List<IsolationTree> built = new ArrayList<>(numTrees);
        while (built.size() < numTrees) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Isolation forest training interrupted after " + built.size() + " trees");
            }
            built.add(IsolationTree.build(subsample(data, this.sampleSize, random), maxDepth, random));
        }
        this.trees = Collections.unmodifiableList(built);
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)), where n is the per-tree sample size.
     *
     * @return score in (0, 1]; close to 1 is anomalous, around 0.5 or below is normal
     */
    public double anomalyScore(double[] point) {
        double normalizer = IsolationNode.averagePathLength(sampleSize);
        if (trees.isEmpty() || normalizer <= 0) {
            return 0.0;
        }
        double totalPath = 0.0;
        for (IsolationTree tree : trees) {
            totalPath += tree.pathLength(point);
        }
        return Math.pow(2.0, -(totalPath / trees.size()) / normalizer);
    }

    public double[] anomalyScores(double[][] points) {
        return Arrays.stream(points).mapToDouble(this::anomalyScore).toArray();
    }

    /** Draws {@code size} distinct rows without replacement. */
    private static double[][] subsample(double[][] data, int size, Random random) {
        if (size >= data.length) {
            return data.clone();
        }
        int[] order = new int[data.length];
        Arrays.setAll(order, i -> i);
        double[][] drawn = new double[size][];
        for (int picked = 0; picked < size; picked++) {
            int pick = picked + random.nextInt(order.length - picked);
            int row = order[pick];
            order[pick] = order[picked];
            order[picked] = row;
            drawn[picked] = data[row];
        }
        return drawn;
    }

    @JsonIgnore
    public int getTreeCount() {
        return trees.size();
    }

    @JsonIgnore
    public int getMaxTreeDepth() {
        int max = 0;
        for (IsolationTree tree : trees) {
            max = Math.max(max, tree.getDepth());
        }
        return max;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
}
