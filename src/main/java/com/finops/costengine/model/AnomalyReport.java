package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Anomalies detected for one tenant over a date range, with summary counts")
public class AnomalyReport {

    @Schema(description = "Tenant identifier", example = "tenant-acme")
    String tenantId;

    @Schema(description = "Model version used for scoring", example = "3")
    long modelVersion;

    @Schema(description = "Detected anomalies in chronological order")
    List<AnomalyRecord> anomalies;

    @Schema(description = "Number of anomalies", example = "4")
    int total;

    @Schema(description = "Number of CRITICAL anomalies", example = "1")
    int criticalCount;

    @Schema(description = "Sum of estimated impact", example = "5210.90")
    double totalEstimatedImpact;

    public static AnomalyReport empty(String tenantId, long modelVersion) {
        return AnomalyReport.builder()
                .tenantId(tenantId)
                .modelVersion(modelVersion)
                .anomalies(List.of())
                .build();
    }
}
