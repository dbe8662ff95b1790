package com.finops.costengine.model;

/**
 * Reasons a recommendation was produced with reduced certainty.
 */
public enum Degradation {
    MISSING_MEMORY_METRICS("Memory metrics unavailable; sized on CPU only"),
    SHORT_LOOKBACK("Utilization lookback shorter than recommended");

    private final String description;

    Degradation(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
