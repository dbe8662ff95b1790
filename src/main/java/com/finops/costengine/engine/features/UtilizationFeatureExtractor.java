package com.finops.costengine.engine.features;

import com.finops.costengine.model.UtilizationProfile;
import com.finops.costengine.model.UtilizationSample;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates raw utilization readings of one resource into a {@link UtilizationProfile}.
 * Memory percentiles stay null when no reading carries memory data.
 */
public final class UtilizationFeatureExtractor {

    private UtilizationFeatureExtractor() {}

    public static UtilizationProfile summarize(String resourceId, List<UtilizationSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("No utilization samples for " + resourceId);
        }

        double[] cpu = samples.stream().mapToDouble(UtilizationSample::getCpuPct).sorted().toArray();
        double[] memory = samples.stream()
                .map(UtilizationSample::getMemoryPct)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();

        UtilizationProfile.UtilizationProfileBuilder profile = UtilizationProfile.builder()
                .resourceId(resourceId)
                .avgCpu(Arrays.stream(cpu).average().orElse(0.0))
                .p95Cpu(SeriesStats.percentile(cpu, 95))
                .p99Cpu(SeriesStats.percentile(cpu, 99))
                .avgNetworkIn(samples.stream().mapToDouble(UtilizationSample::getNetworkIn).average().orElse(0.0))
                .avgNetworkOut(samples.stream().mapToDouble(UtilizationSample::getNetworkOut).average().orElse(0.0))
                .observationCount(samples.size());

        if (memory.length > 0) {
            profile.avgMem(Arrays.stream(memory).average().orElse(0.0))
                    .p95Mem(SeriesStats.percentile(memory, 95))
                    .p99Mem(SeriesStats.percentile(memory, 99));
        }
        return profile.build();
    }
}
