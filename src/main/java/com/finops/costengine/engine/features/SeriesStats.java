package com.finops.costengine.engine.features;

/**
 * Summary statistics over slices of a double array.
 */
public final class SeriesStats {

    private SeriesStats() {}

    public static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : mean(values, 0, values.length);
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double sampleStd(double[] values, int from, int to) {
        int count = to - from;
        if (count < 2) return 0.0;
        double mean = mean(values, from, to);
        double m2 = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (count - 1));
    }

    public static double sampleStd(double[] values) {
        return sampleStd(values, 0, values.length);
    }

    /**
     * Percentile with linear interpolation between closest ranks. Input must be sorted.
     */
    public static double percentile(double[] sorted, double pct) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty array");
        }
        double rank = pct / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
