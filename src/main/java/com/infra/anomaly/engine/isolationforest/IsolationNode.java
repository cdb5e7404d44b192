package com.infra.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Internal nodes hold a split (feature, value); external
 * nodes record how many training points reached them so that path lengths of
 * unresolved leaves can be corrected with {@link #averagePathLength(int)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("s")
    private int size;

    @JsonProperty("e")
    private boolean external;

    public IsolationNode() {}

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.external = false;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    /**
     * Depth at which {@code point} is isolated, iteratively to keep inference free of
     * recursion overhead.
     */
    public double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    int depth() {
        if (external) return 0;
        return 1 + Math.max(left.depth(), right.depth());
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
