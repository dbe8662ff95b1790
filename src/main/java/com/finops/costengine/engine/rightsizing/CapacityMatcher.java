package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.model.CatalogEntry;
import com.finops.costengine.model.UtilizationProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;

/**
 * Finds the cheapest catalog type that still covers a resource's p99 utilization plus headroom,
 * without ever exceeding the current type on vCPU or memory.
 *
 * Required capacity:
 *   vCPU   = max(p99Cpu / 100 * current.vcpu * (1 + headroom), minVcpuFloor)
 *   memory = max(p99Mem / 100 * current.memoryGb * (1 + headroom), minMemoryGbFloor)
 *            or CPU-only sizing when the profile carries no memory metrics.
 *
 * Among eligible entries the lowest hourly price wins, then the smallest vCPU, then the
 * smallest memory. An empty result means there is nothing to recommend.
 */
@Component
public class CapacityMatcher {

    private static final Logger log = LoggerFactory.getLogger(CapacityMatcher.class);

    private static final Comparator<CatalogEntry> SELECTION_ORDER = Comparator
            .comparingDouble(CatalogEntry::getHourlyPrice)
            .thenComparingDouble(CatalogEntry::getVcpu)
            .thenComparingDouble(CatalogEntry::getMemoryGb)
            .thenComparing(CatalogEntry::getTypeName);

    private final EngineProperties.RightSizing config;

    public CapacityMatcher(EngineProperties properties) {
        this.config = properties.getRightSizing();
    }

    public Optional<CapacityMatch> match(UtilizationProfile utilization, CatalogEntry current, ResourceCatalog catalog) {
        double headroom = config.getHeadroom();
        double requiredVcpu = Math.max(
                utilization.getP99Cpu() / 100.0 * current.getVcpu() * (1 + headroom),
                config.getMinVcpuFloor());

        Double requiredMemoryGb = null;
        if (utilization.hasMemoryMetrics()) {
            requiredMemoryGb = Math.max(
                    utilization.getP99Mem() / 100.0 * current.getMemoryGb() * (1 + headroom),
                    config.getMinMemoryGbFloor());
        }

        final Double memoryRequirement = requiredMemoryGb;
        Optional<CatalogEntry> candidate = catalog.entries().stream()
                .filter(entry -> entry.getVcpu() >= requiredVcpu)
                .filter(entry -> memoryRequirement == null || entry.getMemoryGb() >= memoryRequirement)
                .filter(entry -> entry.fitsWithin(current))
                .filter(entry -> !config.isSameFamilyOnly() || entry.family().equals(current.family()))
                .min(SELECTION_ORDER);

        if (candidate.isEmpty()) {
            log.debug("No eligible catalog type for {} on {}: requires {} vCPU / {} GB",
                    utilization.getResourceId(), current.getTypeName(),
                    String.format("%.2f", requiredVcpu),
                    requiredMemoryGb == null ? "n/a" : String.format("%.2f", requiredMemoryGb));
            return Optional.empty();
        }

        return Optional.of(new CapacityMatch(utilization, current, candidate.get(),
                requiredVcpu, requiredMemoryGb, headroom));
    }
}
