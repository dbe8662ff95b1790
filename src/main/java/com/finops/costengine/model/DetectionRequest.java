package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Cost timeline to score, with an optional date range restricting which days are scored")
public class DetectionRequest {

    @Schema(description = "Daily costs, including days before the range for rolling context")
    @Builder.Default
    private List<CostObservation> observations = new ArrayList<>();

    @Schema(description = "First day to score (inclusive); omit to start at the first observation", example = "2026-03-01")
    private LocalDate from;

    @Schema(description = "Last day to score (inclusive); omit to end at the last observation", example = "2026-03-31")
    private LocalDate to;
}
