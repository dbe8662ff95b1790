package com.finops.costengine.config;

import com.finops.costengine.model.AnomalySeverity;
import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTraining(int trainingSamples) {
        Counter.builder("model.training.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("model.training.samples")
                .register(registry)
                .record(trainingSamples);
    }

    public void recordTrainingRejected(String reason) {
        Counter.builder("model.training.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(AnomalySeverity severity, double estimatedImpact) {
        Counter.builder("anomaly.detected.count")
                .tag("severity", severity.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("anomaly.estimated_impact")
                .tag("severity", severity.name())
                .register(registry)
                .record(estimatedImpact);
    }

    public void recordRecommendation(RiskLevel riskLevel, double monthlySavings) {
        Counter.builder("recommendation.count")
                .tag("risk_level", riskLevel.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("recommendation.monthly_savings")
                .tag("risk_level", riskLevel.name())
                .register(registry)
                .record(monthlySavings);
    }

    public void recordDegradation(Degradation degradation) {
        Counter.builder("recommendation.degraded.count")
                .tag("cause", degradation.name())
                .register(registry)
                .increment();
    }
}
