package com.finops.costengine.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One node of an isolation tree. Leaves keep the number of training rows that reached them;
 * internal nodes keep an axis-aligned split.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private final int splitFeature;

    @JsonProperty("v")
    private final double splitValue;

    @JsonProperty("l")
    private final IsolationNode left;

    @JsonProperty("r")
    private final IsolationNode right;

    @JsonProperty("s")
    private final int size;

    @JsonCreator
    IsolationNode(@JsonProperty("f") int splitFeature,
                  @JsonProperty("v") double splitValue,
                  @JsonProperty("l") IsolationNode left,
                  @JsonProperty("r") IsolationNode right,
                  @JsonProperty("s") int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, left.size + right.size);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return left == null;
    }

    /**
     * Depth at which the point lands in a leaf, plus the expected remaining depth of the
     * rows that shared that leaf.
     */
    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * c(n): average path length of an unsuccessful BST search over n rows.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
}
