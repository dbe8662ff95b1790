package com.finops.costengine.engine.features;

import com.finops.costengine.model.CostObservation;
import com.finops.costengine.model.FeatureVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a daily cost series into one {@link FeatureVector} per observation.
 *
 * Features:
 *   cost           the day's total cost
 *   delta          cost - previous cost (0 for the first day)
 *   pctDelta       delta / previous cost * 100 (0 when the previous cost is 0)
 *   rollingMean7d  mean of the trailing 7 observations, truncated at the window start
 *   rollingStd7d   sample std of the same window; full-series std when fewer than 2 points
 *   zScore         (cost - rollingMean7d) / (rollingStd7d + 1e-6)
 *   service[0..4]  daily cost of the 5 highest-spend services, zero-padded
 *
 * Pure function of its input: the same window always yields equal vectors.
 */
public final class CostFeatureExtractor {

    public static final int ROLLING_WINDOW = 7;
    public static final double EPSILON = 1e-6;

    private CostFeatureExtractor() {}

    /**
     * Extract features, choosing the service columns from the window itself.
     */
    public static List<FeatureVector> extract(List<CostObservation> window) {
        List<CostObservation> ordered = chronological(window);
        return extract(ordered, topServices(ordered, FeatureVector.SERVICE_FEATURE_COUNT));
    }

    /**
     * Extract features with fixed service columns, e.g. the ones a model was trained with.
     * Columns beyond the given list are zero.
     */
    public static List<FeatureVector> extract(List<CostObservation> window, List<String> serviceColumns) {
        List<CostObservation> ordered = chronological(window);
        int n = ordered.size();
        List<FeatureVector> vectors = new ArrayList<>(n);
        if (n == 0) return vectors;

        double[] costs = new double[n];
        for (int i = 0; i < n; i++) {
            costs[i] = ordered.get(i).getTotalCost();
        }
        double seriesStd = SeriesStats.sampleStd(costs);

        for (int i = 0; i < n; i++) {
            double delta = i == 0 ? 0.0 : costs[i] - costs[i - 1];
            double pctDelta = (i == 0 || costs[i - 1] == 0.0) ? 0.0 : delta / costs[i - 1] * 100.0;

            int from = Math.max(0, i - ROLLING_WINDOW + 1);
            int count = i - from + 1;
            double mean = SeriesStats.mean(costs, from, i + 1);
            double std = count < 2 ? seriesStd : SeriesStats.sampleStd(costs, from, i + 1);
            double z = (costs[i] - mean) / (std + EPSILON);

            vectors.add(FeatureVector.builder()
                    .date(ordered.get(i).getDate())
                    .cost(costs[i])
                    .delta(delta)
                    .pctDelta(pctDelta)
                    .rollingMean7d(mean)
                    .rollingStd7d(std)
                    .zScore(z)
                    .serviceCosts(serviceColumns(ordered.get(i), serviceColumns))
                    .build());
        }
        return vectors;
    }

    /**
     * Names of the services with the highest total cost over the window, at most {@code limit},
     * ties broken alphabetically.
     */
    public static List<String> topServices(List<CostObservation> window, int limit) {
        Map<String, Double> totals = new HashMap<>();
        for (CostObservation obs : window) {
            if (obs.getPerServiceCost() == null) continue;
            obs.getPerServiceCost().forEach((service, cost) -> totals.merge(service, cost, Double::sum));
        }
        return totals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Copy of the window sorted by date. Rejects missing dates, duplicate days and
     * negative or missing costs, both totals and per-service values.
     */
    public static List<CostObservation> chronological(List<CostObservation> window) {
        List<CostObservation> ordered = new ArrayList<>(window);
        for (CostObservation obs : ordered) {
            if (obs.getDate() == null) {
                throw new IllegalArgumentException("Cost observation without a date");
            }
        }
        ordered.sort(Comparator.comparing(CostObservation::getDate));
        for (int i = 0; i < ordered.size(); i++) {
            CostObservation obs = ordered.get(i);
            if (obs.getTotalCost() < 0 || Double.isNaN(obs.getTotalCost())) {
                throw new IllegalArgumentException("Invalid cost " + obs.getTotalCost() + " on " + obs.getDate());
            }
            if (obs.getPerServiceCost() != null) {
                obs.getPerServiceCost().forEach((service, cost) -> {
                    if (cost == null || cost < 0 || Double.isNaN(cost)) {
                        throw new IllegalArgumentException(
                                "Invalid " + service + " cost " + cost + " on " + obs.getDate());
                    }
                });
            }
            if (i > 0 && ordered.get(i - 1).getDate().equals(obs.getDate())) {
                throw new IllegalArgumentException("Duplicate cost observation for " + obs.getDate());
            }
        }
        return ordered;
    }

    private static double[] serviceColumns(CostObservation obs, List<String> services) {
        double[] columns = new double[FeatureVector.SERVICE_FEATURE_COUNT];
        int width = Math.min(services.size(), columns.length);
        for (int k = 0; k < width; k++) {
            columns[k] = obs.serviceCost(services.get(k));
        }
        return columns;
    }
}
