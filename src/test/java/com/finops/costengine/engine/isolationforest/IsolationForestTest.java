package com.finops.costengine.engine.isolationforest;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void scoreSample_outlierScoresLowerThanInlier() {
        double[][] data = gaussianCloud(200, 3, 11L);
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L);

        double inlier = forest.scoreSample(new double[]{0.0, 0.0, 0.0});
        double outlier = forest.scoreSample(new double[]{8.0, -8.0, 8.0});

        assertThat(outlier).isLessThan(inlier);
        assertThat(outlier).isLessThan(-0.6);
        assertThat(inlier).isBetween(-1.0, 0.0);
    }

    @Test
    void fit_sameSeed_sameScores() {
        double[][] data = gaussianCloud(150, 4, 3L);
        IsolationForest a = IsolationForest.fit(data, 50, 128, 7L);
        IsolationForest b = IsolationForest.fit(data, 50, 128, 7L);

        double[] probe = {1.5, -0.3, 2.2, 0.0};
        assertThat(a.scoreSample(probe)).isEqualTo(b.scoreSample(probe));
    }

    @Test
    void fit_sampleSizeCappedAtRowCount() {
        IsolationForest forest = IsolationForest.fit(gaussianCloud(40, 2, 1L), 10, 256, 1L);

        assertThat(forest.getSampleSize()).isEqualTo(40);
        assertThat(forest.getTrees()).hasSize(10);
    }

    @Test
    void fit_constantData_everyPointScoresTheSame() {
        double[][] data = new double[90][];
        for (int i = 0; i < data.length; i++) data[i] = new double[]{100.0, 0.0, 0.0};
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L);

        double atBaseline = forest.scoreSample(new double[]{100.0, 0.0, 0.0});
        double offBaseline = forest.scoreSample(new double[]{500.0, 400.0, 4.0});

        assertThat(offBaseline).isEqualTo(atBaseline);
        assertThat(forest.decisionFunction(new double[]{100.0, 0.0, 0.0}, atBaseline)).isEqualTo(0.0);
    }

    @Test
    void fit_doesNotReorderCallerData() {
        double[][] data = gaussianCloud(64, 2, 5L);
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) copy[i] = data[i].clone();

        IsolationForest.fit(data, 20, 32, 9L);

        assertThat(data).isDeepEqualTo(copy);
    }

    @Test
    void fit_zeroRows_rejected() {
        assertThatThrownBy(() -> IsolationForest.fit(new double[0][], 10, 256, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    private static double[][] gaussianCloud(int rows, int cols, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                data[i][j] = random.nextGaussian();
            }
        }
        return data;
    }
}
