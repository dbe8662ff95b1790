package com.finops.costengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Numeric features of one cost observation. Derived from a window of observations and
 * never stored on its own.
 */
@Value
@Builder
public class FeatureVector {

    public static final int BASE_FEATURE_COUNT = 6;
    public static final int SERVICE_FEATURE_COUNT = 5;
    public static final int FEATURE_COUNT = BASE_FEATURE_COUNT + SERVICE_FEATURE_COUNT;

    LocalDate date;
    double cost;
    double delta;
    double pctDelta;
    double rollingMean7d;
    double rollingStd7d;
    double zScore;
    double[] serviceCosts;

    /**
     * Fixed-width row: cost, delta, pctDelta, rollingMean7d, rollingStd7d, zScore,
     * then one column per tracked service.
     */
    public double[] toArray() {
        double[] row = new double[FEATURE_COUNT];
        row[0] = cost;
        row[1] = delta;
        row[2] = pctDelta;
        row[3] = rollingMean7d;
        row[4] = rollingStd7d;
        row[5] = zScore;
        System.arraycopy(serviceCosts, 0, row, BASE_FEATURE_COUNT, SERVICE_FEATURE_COUNT);
        return row;
    }

    public double[] getServiceCosts() {
        return Arrays.copyOf(serviceCosts, serviceCosts.length);
    }
}
