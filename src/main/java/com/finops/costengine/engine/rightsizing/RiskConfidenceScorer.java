package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.engine.classification.ClassificationRule;
import com.finops.costengine.engine.classification.ClassificationTable;
import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Buckets a capacity match by the spare capacity the chosen type leaves above the requirement.
 *
 * <pre>
 *   LOW    (95%)  every known headroom > 30%
 *   MEDIUM (85%)  every known headroom > 20%
 *   HIGH   (70%)  otherwise
 * </pre>
 *
 * Missing memory metrics or a short utilization lookback cap the result at MEDIUM.
 */
@Component
public class RiskConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(RiskConfidenceScorer.class);

    private static final Map<RiskLevel, Double> CONFIDENCE = Map.of(
            RiskLevel.LOW, 95.0,
            RiskLevel.MEDIUM, 85.0,
            RiskLevel.HIGH, 70.0);

    private static final ClassificationTable<double[], RiskLevel> TABLE = new ClassificationTable<>(List.of(
            new ClassificationRule<>(headrooms -> allAbove(headrooms, 30.0), RiskLevel.LOW),
            new ClassificationRule<>(headrooms -> allAbove(headrooms, 20.0), RiskLevel.MEDIUM)
    ), RiskLevel.HIGH);

    private final EngineProperties.RightSizing config;

    public RiskConfidenceScorer(EngineProperties properties) {
        this.config = properties.getRightSizing();
    }

    public RiskAssessment assess(CapacityMatch match) {
        double cpuHeadroomPct = headroomPct(match.candidate().getVcpu(), match.requiredVcpu());
        Double memoryHeadroomPct = match.memoryKnown()
                ? headroomPct(match.candidate().getMemoryGb(), match.requiredMemoryGb())
                : null;

        double[] known = memoryHeadroomPct == null
                ? new double[]{cpuHeadroomPct}
                : new double[]{cpuHeadroomPct, memoryHeadroomPct};
        RiskLevel risk = TABLE.classify(known);

        List<Degradation> degradations = new ArrayList<>();
        if (!match.memoryKnown()) {
            degradations.add(Degradation.MISSING_MEMORY_METRICS);
        }
        if (match.utilization().getObservationCount() < config.getMinUtilizationObservations()) {
            degradations.add(Degradation.SHORT_LOOKBACK);
        }
        if (!degradations.isEmpty() && risk == RiskLevel.LOW) {
            log.warn("Capping confidence for {} at MEDIUM: {}",
                    match.utilization().getResourceId(), degradations);
            risk = RiskLevel.MEDIUM;
        }

        return new RiskAssessment(risk, CONFIDENCE.get(risk), cpuHeadroomPct, memoryHeadroomPct,
                List.copyOf(degradations));
    }

    static double headroomPct(double capacity, double required) {
        return (capacity - required) / capacity * 100.0;
    }

    private static boolean allAbove(double[] values, double threshold) {
        for (double v : values) {
            if (v <= threshold) return false;
        }
        return true;
    }
}
