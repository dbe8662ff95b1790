package com.finops.costengine.service;

import com.finops.costengine.config.EngineProperties;
import com.finops.costengine.config.MetricsConfig;
import com.finops.costengine.engine.features.CostFeatureExtractor;
import com.finops.costengine.engine.features.SeriesStats;
import com.finops.costengine.engine.isolationforest.IsolationForest;
import com.finops.costengine.exception.TrainingDataInsufficientException;
import com.finops.costengine.model.CostObservation;
import com.finops.costengine.model.FeatureVector;
import com.finops.costengine.model.TenantModel;
import com.finops.costengine.model.TrainingSummary;
import com.finops.costengine.repository.TenantModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Fits a tenant's anomaly model on its cost history and publishes it as a new snapshot version.
 */
@Service
public class AnomalyTrainingService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyTrainingService.class);

    private final TenantModelRegistry registry;
    private final EngineProperties.Anomaly config;
    private final MetricsConfig metricsConfig;

    public AnomalyTrainingService(TenantModelRegistry registry,
                                  EngineProperties properties,
                                  MetricsConfig metricsConfig) {
        this.registry = registry;
        this.config = properties.getAnomaly();
        this.metricsConfig = metricsConfig;
    }

    /**
     * Train and publish a model for the tenant.
     *
     * @throws TrainingDataInsufficientException when fewer than the configured minimum of
     *                                           observations are supplied
     */
    public TrainingSummary train(String tenantId, List<CostObservation> history) {
        if (history.size() < config.getMinTrainingObservations()) {
            log.warn("Tenant {} has insufficient history ({} observations, need {}). Not training.",
                    tenantId, history.size(), config.getMinTrainingObservations());
            metricsConfig.recordTrainingRejected("insufficient_history");
            throw new TrainingDataInsufficientException(tenantId, history.size(), config.getMinTrainingObservations());
        }

        log.info("Training anomaly model for {} on {} observations...", tenantId, history.size());

        List<CostObservation> ordered = CostFeatureExtractor.chronological(history);
        List<String> serviceColumns = CostFeatureExtractor.topServices(ordered, FeatureVector.SERVICE_FEATURE_COUNT);
        double[][] data = CostFeatureExtractor.extract(ordered, serviceColumns).stream()
                .map(FeatureVector::toArray)
                .toArray(double[][]::new);

        long seed = config.getSeed() * 31 + tenantId.hashCode();
        IsolationForest forest = IsolationForest.fit(data, config.getNumTrees(), config.getSampleSize(), seed);

        double[] trainingScores = Arrays.stream(data).mapToDouble(forest::scoreSample).sorted().toArray();
        double offset = SeriesStats.percentile(trainingScores, config.getContamination() * 100.0);
        int numAnomalies = (int) Arrays.stream(trainingScores).filter(score -> score < offset).count();

        double[] costs = ordered.stream().mapToDouble(CostObservation::getTotalCost).toArray();
        double baselineMean = SeriesStats.mean(costs);
        double baselineStd = SeriesStats.sampleStd(costs);
        if (baselineStd == 0.0) {
            log.warn("Tenant {} has a zero-variance cost history ({}); any deviation will be CRITICAL",
                    tenantId, baselineMean);
        }

        Instant trainedAt = Instant.now();
        TenantModel published = registry.publish(TenantModel.builder()
                .tenantId(tenantId)
                .forest(forest)
                .baselineMean(baselineMean)
                .baselineStd(baselineStd)
                .decisionOffset(offset)
                .serviceColumns(serviceColumns)
                .trainingSamples(data.length)
                .trainedAt(trainedAt)
                .build());

        metricsConfig.recordTraining(data.length);
        log.info("Trained anomaly model v{} for {}: {} trees, {} samples, baseline {} +/- {}",
                published.getVersion(), tenantId, forest.getTrees().size(), data.length,
                String.format("%.2f", baselineMean), String.format("%.2f", baselineStd));

        return TrainingSummary.builder()
                .tenantId(tenantId)
                .version(published.getVersion())
                .trainingSamples(data.length)
                .numAnomalies(numAnomalies)
                .numNormal(data.length - numAnomalies)
                .contaminationRate((double) numAnomalies / data.length)
                .baselineMean(baselineMean)
                .baselineStd(baselineStd)
                .trainedAt(trainedAt)
                .build();
    }
}
