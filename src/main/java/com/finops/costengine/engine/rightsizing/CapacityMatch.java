package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.model.CatalogEntry;
import com.finops.costengine.model.UtilizationProfile;

/**
 * The cheapest catalog type that covers a resource's required capacity.
 *
 * @param requiredMemoryGb null when the profile has no memory metrics
 */
public record CapacityMatch(UtilizationProfile utilization,
                            CatalogEntry current,
                            CatalogEntry candidate,
                            double requiredVcpu,
                            Double requiredMemoryGb,
                            double headroom) {

    public static final double HOURS_PER_MONTH = 24 * 30;

    public double currentMonthlyCost() {
        return current.getHourlyPrice() * HOURS_PER_MONTH;
    }

    public double candidateMonthlyCost() {
        return candidate.getHourlyPrice() * HOURS_PER_MONTH;
    }

    public double monthlySavings() {
        return currentMonthlyCost() - candidateMonthlyCost();
    }

    public double savingsPct() {
        double current = currentMonthlyCost();
        return current > 0 ? monthlySavings() / current * 100.0 : 0.0;
    }

    public boolean memoryKnown() {
        return requiredMemoryGb != null;
    }
}
