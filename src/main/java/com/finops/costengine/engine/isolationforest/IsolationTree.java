package com.finops.costengine.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Random;

public final class IsolationTree {

    private final IsolationNode root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") IsolationNode root) {
        this.root = root;
    }

    /**
     * Grows a tree over the given rows. Rows are partitioned in place through an index array,
     * so the caller's data is never copied or reordered.
     */
    static IsolationTree grow(double[][] rows, int[] sampleIndices, int maxDepth, Random random) {
        int[] indices = sampleIndices.clone();
        return new IsolationTree(growNode(rows, indices, 0, indices.length, 0, maxDepth, random));
    }

    private static IsolationNode growNode(double[][] rows, int[] idx, int from, int to,
                                          int depth, int maxDepth, Random random) {
        int n = to - from;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(rows[idx[from]].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double value = rows[idx[i]][feature];
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        // Constant on the drawn feature: nothing left to isolate along this axis
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);
        int boundary = partition(rows, idx, from, to, feature, splitValue);

        IsolationNode left = growNode(rows, idx, from, boundary, depth + 1, maxDepth, random);
        IsolationNode right = growNode(rows, idx, boundary, to, depth + 1, maxDepth, random);
        return IsolationNode.split(feature, splitValue, left, right);
    }

    private static int partition(double[][] rows, int[] idx, int from, int to, int feature, double splitValue) {
        int store = from;
        for (int i = from; i < to; i++) {
            if (rows[idx[i]][feature] < splitValue) {
                int tmp = idx[store];
                idx[store] = idx[i];
                idx[i] = tmp;
                store++;
            }
        }
        return store;
    }

    public double pathLength(double[] point) {
        return root.pathLength(point);
    }

    public IsolationNode getRoot() {
        return root;
    }
}
