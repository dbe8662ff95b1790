package com.finops.costengine.service;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.config.MetricsConfig;
import com.finops.costengine.engine.classification.AnomalyTypeClassifier;
import com.finops.costengine.engine.classification.SeverityClassifier;
import com.finops.costengine.engine.features.CostFeatureExtractor;
import com.finops.costengine.exception.ModelNotTrainedException;
import com.finops.costengine.model.AnomalyRecord;
import com.finops.costengine.model.AnomalyReport;
import com.finops.costengine.model.AnomalySeverity;
import com.finops.costengine.model.AnomalyType;
import com.finops.costengine.model.CostObservation;
import com.finops.costengine.model.FeatureVector;
import com.finops.costengine.model.TenantModel;
import com.finops.costengine.repository.TenantModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores a tenant's cost timeline against its frozen model snapshot.
 *
 * Features are computed over the whole timeline so rolling statistics and the previous-day
 * comparison see context outside the scored range. Only points below the decision boundary
 * produce an {@link AnomalyRecord}.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private static final double ZERO_VARIANCE_TOLERANCE = 1e-9;

    private final TenantModelRegistry registry;
    private final EngineProperties.Anomaly config;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(TenantModelRegistry registry,
                                   EngineProperties properties,
                                   MetricsConfig metricsConfig) {
        this.registry = registry;
        this.config = properties.getAnomaly();
        this.metricsConfig = metricsConfig;
    }

    /**
     * Score the tenant's timeline with its current model.
     *
     * @param from first day to score, inclusive; null for the start of the timeline
     * @param to   last day to score, inclusive; null for the end of the timeline
     * @throws ModelNotTrainedException when the tenant has no published model
     */
    public AnomalyReport detect(String tenantId, List<CostObservation> timeline, LocalDate from, LocalDate to) {
        TenantModel model = registry.find(tenantId).orElseThrow(() -> new ModelNotTrainedException(tenantId));
        return detect(model, timeline, from, to);
    }

    public AnomalyReport detect(TenantModel model, List<CostObservation> timeline, LocalDate from, LocalDate to) {
        String tenantId = model.getTenantId();
        if (timeline.isEmpty()) {
            log.debug("Empty scoring batch for {}", tenantId);
            return AnomalyReport.empty(tenantId, model.getVersion());
        }
        if (timeline.size() < config.getMinScoringObservations()) {
            log.warn("Scoring {} with {} observations; rolling features use a truncated window (recommended {})",
                    tenantId, timeline.size(), config.getMinScoringObservations());
        }

        List<CostObservation> ordered = CostFeatureExtractor.chronological(timeline);
        List<FeatureVector> features = CostFeatureExtractor.extract(ordered, model.getServiceColumns());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            CostObservation obs = ordered.get(i);
            if (!inRange(obs.getDate(), from, to)) continue;

            double score = model.getForest().decisionFunction(features.get(i).toArray(), model.getDecisionOffset());
            if (!isOutlier(model, obs.getTotalCost(), score)) continue;

            CostObservation previous = i > 0 ? ordered.get(i - 1) : null;
            anomalies.add(toRecord(model, obs, previous, score));
        }

        AnomalyReport report = summarize(tenantId, model.getVersion(), anomalies);
        log.info("Detected {} anomalies for {} ({} critical) with model v{}",
                report.getTotal(), tenantId, report.getCriticalCount(), model.getVersion());
        return report;
    }

    private boolean isOutlier(TenantModel model, double cost, double score) {
        if (score < 0) return true;
        // A flat baseline isolates nothing, so any move off it is abnormal
        return model.isZeroVariance() && Math.abs(cost - model.getBaselineMean()) > ZERO_VARIANCE_TOLERANCE;
    }

    private AnomalyRecord toRecord(TenantModel model, CostObservation obs, CostObservation previous, double score) {
        double cost = obs.getTotalCost();
        double z = model.baselineZScore(cost);
        double changePct = AnomalyTypeClassifier.changePct(previous == null ? null : previous.getTotalCost(), cost);

        AnomalySeverity severity = SeverityClassifier.classify(z, score);
        AnomalyType type = AnomalyTypeClassifier.classify(changePct);
        double impact = Math.max(0.0, cost - model.getBaselineMean());

        metricsConfig.recordAnomaly(severity, impact);

        return AnomalyRecord.builder()
                .date(obs.getDate())
                .cost(cost)
                .anomalyScore(score)
                .severity(severity)
                .type(type)
                .affectedServices(affectedServices(obs, previous, config.getAffectedServicesLimit()))
                .estimatedImpact(impact)
                .baselineZScore(z)
                .costChangePct(changePct)
                .modelVersion(model.getVersion())
                .build();
    }

    /**
     * Services with the largest absolute cost change against the previous observation.
     * Without a previous observation the day's own per-service costs count as the change.
     */
    static Set<String> affectedServices(CostObservation obs, CostObservation previous, int limit) {
        Set<String> services = new TreeSet<>();
        if (obs.getPerServiceCost() != null) services.addAll(obs.getPerServiceCost().keySet());
        if (previous != null && previous.getPerServiceCost() != null) {
            services.addAll(previous.getPerServiceCost().keySet());
        }

        Map<String, Double> deltas = new LinkedHashMap<>();
        for (String service : services) {
            double before = previous == null ? 0.0 : previous.serviceCost(service);
            double delta = Math.abs(obs.serviceCost(service) - before);
            if (delta > 0) deltas.put(service, delta);
        }

        Set<String> top = new LinkedHashSet<>();
        deltas.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(limit)
                .forEach(e -> top.add(e.getKey()));
        return Collections.unmodifiableSet(top);
    }

    private static boolean inRange(LocalDate date, LocalDate from, LocalDate to) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }

    private static AnomalyReport summarize(String tenantId, long version, List<AnomalyRecord> anomalies) {
        int critical = (int) anomalies.stream().filter(a -> a.getSeverity() == AnomalySeverity.CRITICAL).count();
        double impact = anomalies.stream().mapToDouble(AnomalyRecord::getEstimatedImpact).sum();
        return AnomalyReport.builder()
                .tenantId(tenantId)
                .modelVersion(version)
                .anomalies(List.copyOf(anomalies))
                .total(anomalies.size())
                .criticalCount(critical)
                .totalEstimatedImpact(impact)
                .build();
    }
}
