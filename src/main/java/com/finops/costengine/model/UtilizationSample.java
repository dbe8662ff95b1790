package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One raw utilization reading for a resource")
public class UtilizationSample {

    @Schema(description = "Reading time")
    private Instant timestamp;

    @Schema(description = "CPU utilization in percent", example = "23.5")
    private double cpuPct;

    @Schema(description = "Memory utilization in percent; null when no agent reports memory", example = "41.0")
    private Double memoryPct;

    @Schema(description = "Network bytes in", example = "1048576")
    private double networkIn;

    @Schema(description = "Network bytes out", example = "524288")
    private double networkOut;
}
