package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Right-sizing recommendations for a batch of resources, highest savings first")
public class RecommendationReport {

    @Schema(description = "Recommendations sorted by monthly savings, descending")
    List<Recommendation> recommendations;

    @Schema(description = "Sum of monthly savings", example = "412.80")
    double totalPotentialSavings;

    @Schema(description = "Number of resources analyzed", example = "12")
    int analyzedCount;

    @Schema(description = "Resources with nothing to recommend", example = "7")
    int skippedCount;
}
