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
@Schema(description = "A resource to right-size: its current type and utilization summary")
public class ResourceRequest {

    @Schema(description = "Current resource type name", example = "m5.xlarge")
    private String currentType;

    @Schema(description = "Utilization summary over the lookback window")
    private UtilizationProfile utilization;
}
