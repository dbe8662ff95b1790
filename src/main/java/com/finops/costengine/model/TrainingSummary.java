package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Outcome of training a tenant's anomaly model")
public class TrainingSummary {

    @Schema(description = "Tenant identifier", example = "tenant-acme")
    String tenantId;

    @Schema(description = "Published model version", example = "3")
    long version;

    @Schema(description = "Number of observations used for training", example = "120")
    int trainingSamples;

    @Schema(description = "Training points below the decision boundary", example = "12")
    int numAnomalies;

    @Schema(description = "Training points at or above the decision boundary", example = "108")
    int numNormal;

    @Schema(description = "numAnomalies / trainingSamples", example = "0.1")
    double contaminationRate;

    @Schema(description = "Mean daily cost over the training window", example = "1180.25")
    double baselineMean;

    @Schema(description = "Standard deviation of daily cost over the training window", example = "96.4")
    double baselineStd;

    @Schema(description = "Training time")
    Instant trainedAt;
}
