package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Utilization summary of one resource over the lookback window")
public class UtilizationProfile {

    @Schema(description = "Resource identifier", example = "i-0a1b2c3d4e5f")
    private String resourceId;

    @Schema(description = "Average CPU utilization (%)", example = "15.0")
    private double avgCpu;

    @Schema(description = "95th percentile CPU utilization (%)", example = "25.0")
    private double p95Cpu;

    @Schema(description = "99th percentile CPU utilization (%)", example = "30.0")
    private double p99Cpu;

    @Schema(description = "Average memory utilization (%), absent without a memory agent", example = "35.0")
    private Double avgMem;

    @Schema(description = "95th percentile memory utilization (%)", example = "42.0")
    private Double p95Mem;

    @Schema(description = "99th percentile memory utilization (%)", example = "48.0")
    private Double p99Mem;

    @Schema(description = "Average network bytes in", example = "1048576")
    private double avgNetworkIn;

    @Schema(description = "Average network bytes out", example = "524288")
    private double avgNetworkOut;

    @Schema(description = "Number of observations the percentiles were computed from", example = "336")
    private int observationCount;

    public boolean hasMemoryMetrics() {
        return p99Mem != null;
    }
}
