package com.finops.costengine.service;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.config.MetricsConfig;
import com.finops.costengine.engine.rightsizing.CapacityMatcher;
import com.finops.costengine.engine.rightsizing.RecommendationAssembler;
import com.finops.costengine.engine.rightsizing.RiskConfidenceScorer;
import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.Recommendation;
import com.finops.costengine.model.RecommendationReport;
import com.finops.costengine.model.RiskLevel;
import com.finops.costengine.model.UtilizationProfile;
import com.finops.costengine.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.finops.costengine.testutil.TestDataFactory.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RightSizingServiceTest {

    private EngineProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RightSizingService service;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.defaultProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = new RightSizingService(
                TestDataFactory.awsCatalog(),
                new CapacityMatcher(properties),
                new RiskConfidenceScorer(properties),
                new RecommendationAssembler(),
                properties,
                new MetricsConfig(meterRegistry));
    }

    @Test
    void recommend_overProvisionedXlarge_downsizesWithMediumRisk() {
        UtilizationProfile profile = TestDataFactory.profile("i-web-1", 15, 25, 30, 20, 28, 30);

        Recommendation rec = service.recommend(request("m5.xlarge", profile)).orElseThrow();

        assertThat(rec.getRecommendedType()).isEqualTo("m5.large");
        assertThat(rec.getCurrentMonthlyCost()).isEqualTo(138.24);
        assertThat(rec.getRecommendedMonthlyCost()).isEqualTo(69.12);
        assertThat(rec.getMonthlySavings()).isEqualTo(69.12);
        assertThat(rec.getSavingsPct()).isEqualTo(50.0);
        assertThat(rec.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(rec.getConfidence()).isEqualTo(85.0);
        assertThat(rec.getDegradations()).isEmpty();
        assertThat(rec.getReasoning()).contains("$69.12/month");
    }

    @Test
    void recommend_noSmallerFit_returnsEmpty() {
        UtilizationProfile profile = TestDataFactory.cpuOnlyProfile("i-batch", 80, 92, 95);

        assertThat(service.recommend(request("m5.large", profile))).isEmpty();
    }

    @Test
    void recommend_unknownType_returnsEmpty() {
        UtilizationProfile profile = TestDataFactory.cpuOnlyProfile("i-odd", 5, 10, 15);

        assertThat(service.recommend(request("z9.mega", profile))).isEmpty();
    }

    @Test
    void recommend_alreadySmallest_returnsEmpty() {
        UtilizationProfile profile = TestDataFactory.profile("i-tiny", 1, 2, 3, 5, 8, 10);

        // t3.micro is the only t3 fit, so the match is the current type and saves nothing
        assertThat(service.recommend(request("t3.micro", profile))).isEmpty();
    }

    @Test
    void recommend_withoutMemoryMetrics_flagsDegradation() {
        UtilizationProfile profile = TestDataFactory.cpuOnlyProfile("i-cpu", 5, 10, 20);

        Recommendation rec = service.recommend(request("m5.xlarge", profile)).orElseThrow();

        assertThat(rec.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(rec.getDegradations()).containsExactly(Degradation.MISSING_MEMORY_METRICS);
        assertThat(rec.getRequiredMemoryGb()).isNull();
        assertThat(meterRegistry.counter("recommendation.degraded.count", "cause", "MISSING_MEMORY_METRICS").count())
                .isEqualTo(1.0);
    }

    @Test
    void recommend_belowMinimumSavingsPct_returnsEmpty() {
        properties.getRightSizing().setMinSavingsPct(60.0);
        UtilizationProfile profile = TestDataFactory.profile("i-web-1", 15, 25, 30, 20, 28, 30);

        assertThat(service.recommend(request("m5.xlarge", profile))).isEmpty();
    }

    @Test
    void recommend_missingUtilization_rejected() {
        assertThatThrownBy(() -> service.recommend(request("m5.xlarge", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recommend_batch_sortedBySavingsWithTotals() {
        RecommendationReport report = service.recommend(List.of(
                request("m5.xlarge", TestDataFactory.profile("i-small-save", 15, 25, 30, 20, 28, 30)),
                request("m5.4xlarge", TestDataFactory.profile("i-big-save", 5, 8, 10, 5, 8, 10)),
                request("m5.large", TestDataFactory.cpuOnlyProfile("i-hot", 80, 92, 95)),
                request("z9.mega", TestDataFactory.cpuOnlyProfile("i-unknown", 5, 10, 15))
        ));

        assertThat(report.getRecommendations())
                .extracting(Recommendation::getResourceId)
                .containsExactly("i-big-save", "i-small-save");
        assertThat(report.getAnalyzedCount()).isEqualTo(4);
        assertThat(report.getSkippedCount()).isEqualTo(2);
        // 483.84 (m5.4xlarge -> m5.large) + 69.12 (m5.xlarge -> m5.large)
        assertThat(report.getTotalPotentialSavings()).isEqualTo(552.96);
        assertThat(report.getRecommendations()).allSatisfy(r -> assertThat(r.getMonthlySavings()).isPositive());
    }

    @Test
    void recommend_emptyBatch_emptyReport() {
        RecommendationReport report = service.recommend(List.of());

        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getTotalPotentialSavings()).isEqualTo(0.0);
        assertThat(report.getAnalyzedCount()).isZero();
    }

    @Test
    void catalog_orderedByCapacity() {
        assertThat(service.catalog()).hasSize(12);
        assertThat(service.catalog().get(0).getTypeName()).isEqualTo("t3.micro");
        assertThat(service.catalog().get(11).getTypeName()).isEqualTo("m5.4xlarge");
    }

    @Test
    void recommend_sameInput_sameRecommendation() {
        UtilizationProfile profile = TestDataFactory.profile("i-web-1", 15, 25, 30, 20, 28, 30);

        Optional<Recommendation> first = service.recommend(request("m5.xlarge", profile));
        Optional<Recommendation> second = service.recommend(request("m5.xlarge", profile));

        assertThat(second).isEqualTo(first);
    }
}
