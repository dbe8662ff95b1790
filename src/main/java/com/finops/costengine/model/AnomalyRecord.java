package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

@Value
@Builder
@Schema(description = "A cost observation flagged as anomalous against the tenant's trained baseline")
public class AnomalyRecord {

    @Schema(description = "Day of the anomaly", example = "2026-03-14")
    LocalDate date;

    @Schema(description = "Total cost on that day", example = "4820.75")
    double cost;

    @Schema(description = "Isolation score; negative values are outliers, lower is more anomalous", example = "-0.142")
    double anomalyScore;

    @Schema(description = "Severity from baseline z-score and isolation score", example = "CRITICAL")
    AnomalySeverity severity;

    @Schema(description = "Shape of the anomaly relative to the previous day", example = "SPIKE")
    AnomalyType type;

    @Schema(description = "Services whose cost change contributed most", example = "[\"AmazonEC2\"]")
    Set<String> affectedServices;

    @Schema(description = "Spend above the baseline mean, never negative", example = "3570.35")
    double estimatedImpact;

    @Schema(description = "Z-score of the cost against the training baseline", example = "6.8")
    double baselineZScore;

    @Schema(description = "Day-over-day cost change in percent", example = "285.5")
    double costChangePct;

    @Schema(description = "Version of the tenant model that produced this record", example = "3")
    long modelVersion;
}
