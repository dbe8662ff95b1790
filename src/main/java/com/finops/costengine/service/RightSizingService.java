package com.finops.costengine.service;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.config.MetricsConfig;
import com.finops.costengine.engine.rightsizing.CapacityMatch;
import com.finops.costengine.engine.rightsizing.CapacityMatcher;
import com.finops.costengine.engine.rightsizing.RecommendationAssembler;
import com.finops.costengine.engine.rightsizing.ResourceCatalog;
import com.finops.costengine.engine.rightsizing.RiskAssessment;
import com.finops.costengine.engine.rightsizing.RiskConfidenceScorer;
import com.finops.costengine.model.CatalogEntry;
import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.Recommendation;
import com.finops.costengine.model.RecommendationReport;
import com.finops.costengine.model.ResourceRequest;
import com.finops.costengine.model.UtilizationProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces downsizing recommendations for a batch of resources against the configured catalog.
 * Resources are independent; nothing is shared between them beyond the read-only catalog.
 */
@Service
public class RightSizingService {

    private static final Logger log = LoggerFactory.getLogger(RightSizingService.class);

    private final ResourceCatalog catalog;
    private final CapacityMatcher capacityMatcher;
    private final RiskConfidenceScorer riskScorer;
    private final RecommendationAssembler assembler;
    private final EngineProperties.RightSizing config;
    private final MetricsConfig metricsConfig;

    public RightSizingService(ResourceCatalog catalog,
                              CapacityMatcher capacityMatcher,
                              RiskConfidenceScorer riskScorer,
                              RecommendationAssembler assembler,
                              EngineProperties properties,
                              MetricsConfig metricsConfig) {
        this.catalog = catalog;
        this.capacityMatcher = capacityMatcher;
        this.riskScorer = riskScorer;
        this.assembler = assembler;
        this.config = properties.getRightSizing();
        this.metricsConfig = metricsConfig;
    }

    public RecommendationReport recommend(List<ResourceRequest> resources) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ResourceRequest resource : resources) {
            recommend(resource).ifPresent(recommendations::add);
        }

        List<Recommendation> sorted = assembler.sortBySavings(recommendations);
        double totalSavings = sorted.stream().mapToDouble(Recommendation::getMonthlySavings).sum();

        log.info("Generated {} recommendations for {} resources, total savings: ${}/month",
                sorted.size(), resources.size(), String.format("%.2f", totalSavings));

        return RecommendationReport.builder()
                .recommendations(sorted)
                .totalPotentialSavings(Math.round(totalSavings * 100.0) / 100.0)
                .analyzedCount(resources.size())
                .skippedCount(resources.size() - sorted.size())
                .build();
    }

    /**
     * Recommendation for a single resource, or empty when nothing cheaper fits.
     */
    public Optional<Recommendation> recommend(ResourceRequest resource) {
        UtilizationProfile utilization = resource.getUtilization();
        if (utilization == null) {
            throw new IllegalArgumentException("Resource on " + resource.getCurrentType() + " has no utilization profile");
        }

        Optional<CatalogEntry> current = catalog.find(resource.getCurrentType());
        if (current.isEmpty()) {
            log.warn("Unknown resource type {} for {}. Skipping.", resource.getCurrentType(), utilization.getResourceId());
            return Optional.empty();
        }
        if (!utilization.hasMemoryMetrics()) {
            log.warn("No memory metrics for {}; falling back to CPU-only sizing", utilization.getResourceId());
        }

        Optional<CapacityMatch> match = capacityMatcher.match(utilization, current.get(), catalog);
        if (match.isEmpty()) {
            return Optional.empty();
        }

        CapacityMatch capacityMatch = match.get();
        if (capacityMatch.monthlySavings() <= 0 || capacityMatch.savingsPct() < config.getMinSavingsPct()) {
            log.debug("No worthwhile saving for {}: {} -> {}", utilization.getResourceId(),
                    capacityMatch.current().getTypeName(), capacityMatch.candidate().getTypeName());
            return Optional.empty();
        }

        RiskAssessment risk = riskScorer.assess(capacityMatch);
        Recommendation recommendation = assembler.assemble(capacityMatch, risk);
        if (recommendation.getMonthlySavings() <= 0) {
            return Optional.empty();
        }

        metricsConfig.recordRecommendation(recommendation.getRiskLevel(), recommendation.getMonthlySavings());
        for (Degradation degradation : recommendation.getDegradations()) {
            metricsConfig.recordDegradation(degradation);
        }
        return Optional.of(recommendation);
    }

    public List<CatalogEntry> catalog() {
        return catalog.entries();
    }
}
