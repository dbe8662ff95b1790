package com.finops.costengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.finops.costengine.engine.isolationforest.IsolationForest;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Frozen anomaly model of one tenant: the fitted forest plus the cost baseline captured at
 * training time. Scoring reads a snapshot; retraining publishes a new version.
 */
@Value
@Builder
@Jacksonized
public class TenantModel {

    String tenantId;

    @With
    long version;

    IsolationForest forest;

    // Mean and sample std of raw daily cost over the training window
    double baselineMean;
    double baselineStd;

    // Training-score percentile at the contamination rate; scores below it are outliers
    double decisionOffset;

    // Services backing the per-service feature columns, in column order
    List<String> serviceColumns;

    int trainingSamples;

    Instant trainedAt;

    @JsonIgnore
    public boolean isZeroVariance() {
        return baselineStd == 0.0;
    }

    public double baselineZScore(double cost) {
        return (cost - baselineMean) / (baselineStd + 1e-6);
    }
}
