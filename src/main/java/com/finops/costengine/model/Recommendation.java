package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Downsizing recommendation for one resource")
public class Recommendation {

    @Schema(description = "Resource identifier", example = "i-0a1b2c3d4e5f")
    String resourceId;

    @Schema(description = "Current resource type", example = "m5.xlarge")
    String currentType;

    @Schema(description = "Recommended resource type", example = "m5.large")
    String recommendedType;

    @Schema(description = "Current monthly cost (hourly price x 720)", example = "138.24")
    double currentMonthlyCost;

    @Schema(description = "Recommended monthly cost", example = "69.12")
    double recommendedMonthlyCost;

    @Schema(description = "current - recommended, always positive", example = "69.12")
    double monthlySavings;

    @Schema(description = "Savings relative to current cost (%)", example = "50.0")
    double savingsPct;

    @Schema(description = "vCPU required after headroom", example = "1.44")
    double requiredVcpu;

    @Schema(description = "Memory (GB) required after headroom; absent without memory metrics", example = "5.76")
    Double requiredMemoryGb;

    @Schema(description = "Spare CPU of the recommended type above the requirement (%)", example = "28.0")
    double cpuHeadroomPct;

    @Schema(description = "Spare memory of the recommended type above the requirement (%)", example = "28.0")
    Double memoryHeadroomPct;

    @Schema(description = "Risk of under-provisioning", example = "MEDIUM")
    RiskLevel riskLevel;

    @Schema(description = "Confidence (0-100)", example = "85.0")
    double confidence;

    @Schema(description = "Human-readable explanation")
    String reasoning;

    @Schema(description = "Reasons the recommendation carries reduced certainty")
    List<Degradation> degradations;
}
