package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Daily cost of one tenant, optionally broken down by service")
public class CostObservation {

    @Schema(description = "Calendar day (ISO-8601)", example = "2026-03-14")
    private LocalDate date;

    @Schema(description = "Total cost for the day", example = "1250.40")
    private double totalCost;

    @Schema(description = "Cost per service for the day", example = "{\"AmazonEC2\": 820.10, \"AmazonS3\": 120.00}")
    @Builder.Default
    private Map<String, Double> perServiceCost = new HashMap<>();

    public double serviceCost(String service) {
        if (perServiceCost == null) return 0.0;
        Double cost = perServiceCost.get(service);
        return cost == null ? 0.0 : cost;
    }
}
