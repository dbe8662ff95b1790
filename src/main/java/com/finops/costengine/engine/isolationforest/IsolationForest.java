package com.finops.costengine.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of random axis-aligned partitioning trees. Points that need fewer splits to be
 * isolated from the bulk of the training data get lower (more anomalous) scores.
 *
 * <p>Instances are immutable once fitted and safe to share between scoring threads.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize) {
        this.trees = trees == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
    }

    /**
     * Fit a forest on the given rows.
     *
     * @param data       training rows, all of the same width
     * @param numTrees   number of trees
     * @param maxSamples rows drawn without replacement per tree, capped at the row count
     * @param seed       random seed, so identical input gives an identical forest
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        int sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(data, drawSample(data.length, sampleSize, random), maxDepth, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    /**
     * Raw isolation score in the "lower is more anomalous" convention: {@code -2^(-E[h(x)]/c(n))},
     * in [-1, 0). Around -0.5 is unremarkable, close to -1 is clearly isolated.
     */
    public double scoreSample(double[] point) {
        if (trees.isEmpty()) return -0.5;

        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return -0.5;
        return -Math.pow(2.0, -meanPath / c);
    }

    /**
     * Score shifted by the decision offset learned at training time. Negative means outlier.
     */
    public double decisionFunction(double[] point, double offset) {
        return scoreSample(point) - offset;
    }

    private static int[] drawSample(int population, int size, Random random) {
        int[] all = new int[population];
        for (int i = 0; i < population; i++) all[i] = i;
        // Partial Fisher-Yates: the first `size` slots become the sample
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(all, 0, sample, 0, size);
        return sample;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }
}
