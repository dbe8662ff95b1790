package com.finops.costengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Capacity and price of one resource type")
public class CatalogEntry {

    @Schema(description = "Resource type name", example = "m5.large")
    private String typeName;

    @Schema(description = "Virtual CPUs", example = "2")
    private double vcpu;

    @Schema(description = "Memory in GB", example = "8")
    private double memoryGb;

    @Schema(description = "On-demand hourly price", example = "0.096")
    private double hourlyPrice;

    /**
     * Instance family, the part of the type name before the first dot ("m5" for "m5.large").
     */
    public String family() {
        int dot = typeName.indexOf('.');
        return dot < 0 ? typeName : typeName.substring(0, dot);
    }

    public boolean fitsWithin(CatalogEntry other) {
        return vcpu <= other.vcpu && memoryGb <= other.memoryGb;
    }
}
